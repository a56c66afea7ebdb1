package com.editguard.core.impact;

import com.editguard.core.repo.ComplexityTier;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.StylingApproach;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.ImpactLevel;
import com.editguard.core.request.PropertyEdit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HeuristicImpactAnalyzer: default {@link ImpactAnalyzer}, text heuristics only.
 *
 * Direct changes:   one per property edit, target mapped through the component's styling approach.
 * Cascade changes:  optional parent-container when other components import this one;
 *                   required design-system cascade when a token-backed property changes
 *                   and the repository has design tokens.
 * Preservation:     exports, imports, props interface, hooks/functions (critical, regex).
 * Expected scope:   2 lines per direct change + 5 per required cascade.
 *                   Risk follows the highest edit impact. Free-text-only requests are
 *                   MEDIUM, or SIGNIFICANT scope at HIGH risk against a complex component.
 *
 * Callers that already hold an analysis pass it to the orchestrator directly and skip this.
 */
@Component
public class HeuristicImpactAnalyzer implements ImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HeuristicImpactAnalyzer.class);

    private static final int LINES_PER_DIRECT_CHANGE     = 2;
    private static final int LINES_PER_REQUIRED_CASCADE  = 5;
    private static final int LINES_FOR_FREE_TEXT         = 5;
    private static final int LINES_FOR_FREE_TEXT_COMPLEX = 15;

    private static final Set<String> TOKEN_BACKED_PROPERTIES = Set.of("color", "font-size", "spacing");
    private static final Set<String> SIMPLE_PROPERTIES       = Set.of("color", "font-size", "margin", "padding");
    private static final Set<String> LAYOUT_PROPERTIES       = Set.of("display", "flex-direction", "align-items");

    private static final Map<String, String> FONT_SIZE_CLASSES = Map.of(
            "12px", "xs", "14px", "sm", "16px", "base", "18px", "lg", "20px", "xl", "24px", "2xl");

    private static final Map<String, String> SPACING_CLASSES = Map.of(
            "4px", "1", "8px", "2", "12px", "3", "16px", "4", "20px", "5", "24px", "6");

    // =========================================================================
    // ImpactAnalyzer contract
    // =========================================================================

    @Override
    public ChangeImpactAnalysis analyze(ChangeRequest request, TargetComponent component, RepoContext repo) {

        List<DirectChange>     direct   = directChanges(request, component);
        List<CascadeChange>    cascades = cascadeChanges(request, component, repo);
        List<PreservationRule> rules    = preservationRules(component);
        List<ValidationCheck>  checks   = validationChecks(component);
        ExpectedScope          scope    = expectedScope(request, component, direct, cascades);

        log.debug("[ImpactAnalyzer] component={} direct={} cascade={} rules={} scope={}",
                component.getName(), direct.size(), cascades.size(), rules.size(), scope);

        return new ChangeImpactAnalysis(scope, direct, cascades, rules, checks);
    }

    // =========================================================================
    // Direct changes
    // =========================================================================

    private List<DirectChange> directChanges(ChangeRequest request, TargetComponent component) {
        List<DirectChange> changes = new ArrayList<>();
        String selector = request.getElement().getSelector();

        for (PropertyEdit edit : request.getEdits()) {
            String property = edit.getProperty().toLowerCase();
            StylingApproach approach = component.getStylingApproach();

            DirectChange.Type type;
            String            target;
            String            newValue = edit.getAfter();

            switch (approach) {
                case TAILWIND -> {
                    type     = DirectChange.Type.CLASS_NAME;
                    target   = tailwindClass(property, edit.getAfter());
                    newValue = target;
                }
                case STYLED_COMPONENTS -> {
                    type   = DirectChange.Type.CSS_PROPERTY;
                    target = edit.camelCaseProperty();
                }
                case CSS_MODULES -> {
                    type   = DirectChange.Type.CLASS_NAME;
                    target = property.replace('-', '_') + "_class";
                }
                default -> {
                    type   = component.hasInlineStyles() ? DirectChange.Type.INLINE_STYLE : DirectChange.Type.CSS_PROPERTY;
                    target = property;
                }
            }

            changes.add(new DirectChange(type, selector, target, edit.getBefore(), newValue,
                    directChangeConfidence(property)));
        }
        return changes;
    }

    private double directChangeConfidence(String property) {
        if (SIMPLE_PROPERTIES.contains(property)) return 0.9;
        if (LAYOUT_PROPERTIES.contains(property)) return 0.7;
        return 0.5;
    }

    // =========================================================================
    // Cascade changes
    // =========================================================================

    private List<CascadeChange> cascadeChanges(ChangeRequest request, TargetComponent component, RepoContext repo) {
        List<CascadeChange> cascades = new ArrayList<>();

        List<String> usedBy = repo.getComponents().stream()
                .filter(other -> !other.getName().equals(component.getName()))
                .filter(other -> other.getImports().stream().anyMatch(i -> i.contains(component.getName())))
                .map(TargetComponent::getName)
                .collect(Collectors.toList());

        if (!usedBy.isEmpty()) {
            cascades.add(new CascadeChange(CascadeChange.Type.PARENT_CONTAINER, String.join(", ", usedBy),
                    "Parent components may need layout adjustments", false, 0.3));
        }

        boolean touchesTokens = request.getEdits().stream()
                .anyMatch(e -> TOKEN_BACKED_PROPERTIES.contains(e.getProperty().toLowerCase()));

        if (touchesTokens && repo.hasDesignTokens()) {
            cascades.add(new CascadeChange(CascadeChange.Type.DESIGN_SYSTEM, "design-system",
                    "Design system tokens may need updates for consistency", true, 0.8));
        }
        return cascades;
    }

    // =========================================================================
    // Preservation rules and validation checks
    // =========================================================================

    private List<PreservationRule> preservationRules(TargetComponent component) {
        List<PreservationRule> rules = new ArrayList<>();

        if (!component.getExports().isEmpty()) {
            rules.add(PreservationRule.critical(PreservationRule.Type.STRUCTURE,
                    "Preserve all component exports", "export\\s+(default\\s+)?(function|const|class)"));
        }
        if (!component.getImports().isEmpty()) {
            rules.add(PreservationRule.critical(PreservationRule.Type.STRUCTURE,
                    "Preserve all import statements", "import\\s+.*from\\s+['\"][^'\"]+['\"]"));
        }
        if (!component.getProps().isEmpty()) {
            rules.add(PreservationRule.critical(PreservationRule.Type.STRUCTURE,
                    "Preserve component props interface", "interface\\s+\\w+Props"));
        }
        rules.add(PreservationRule.critical(PreservationRule.Type.FUNCTIONALITY,
                "Preserve all component functionality", "use\\w+\\(|function\\s+\\w+|const\\s+\\w+\\s*="));

        return rules;
    }

    private List<ValidationCheck> validationChecks(TargetComponent component) {
        List<ValidationCheck> checks = new ArrayList<>();
        checks.add(new ValidationCheck(ValidationCheck.Type.SYNTAX,           "Validate TypeScript/JavaScript syntax", true));
        checks.add(new ValidationCheck(ValidationCheck.Type.INTENT_ALIGNMENT, "Verify changes match visual intent",    true));
        checks.add(new ValidationCheck(ValidationCheck.Type.PRESERVATION,     "Verify critical code is preserved",     true));
        checks.add(new ValidationCheck(ValidationCheck.Type.SCOPE,            "Verify change scope is appropriate",    true));

        if (component.getComplexity() != ComplexityTier.SIMPLE) {
            checks.add(new ValidationCheck(ValidationCheck.Type.BUILD, "Verify code builds successfully", false));
        }
        return checks;
    }

    // =========================================================================
    // Expected scope
    // =========================================================================

    private ExpectedScope expectedScope(ChangeRequest request,
                                        TargetComponent component,
                                        List<DirectChange> direct,
                                        List<CascadeChange> cascades) {
        long    required = cascades.stream().filter(CascadeChange::isRequired).count();
        boolean freeText = request.getEdits().isEmpty();
        boolean complex  = component.getComplexity() == ComplexityTier.COMPLEX;

        int lines;
        if (!direct.isEmpty()) {
            lines = direct.size() * LINES_PER_DIRECT_CHANGE;
        } else {
            lines = complex ? LINES_FOR_FREE_TEXT_COMPLEX : LINES_FOR_FREE_TEXT;
        }
        lines += (int) required * LINES_PER_REQUIRED_CASCADE;

        RiskLevel risk;
        if (freeText) {
            risk = complex ? RiskLevel.HIGH : RiskLevel.MEDIUM;
        } else {
            risk = riskFor(request.maxImpact());
        }

        return new ExpectedScope(lines, 1 + (int) required, ScopeTier.forExpectedLines(lines), risk);
    }

    private RiskLevel riskFor(ImpactLevel impact) {
        return switch (impact) {
            case LOW    -> RiskLevel.LOW;
            case MEDIUM -> RiskLevel.MEDIUM;
            case HIGH   -> RiskLevel.HIGH;
        };
    }

    // =========================================================================
    // Styling vocabulary
    // =========================================================================

    private String tailwindClass(String property, String value) {
        return switch (property) {
            case "font-size"        -> "text-" + FONT_SIZE_CLASSES.getOrDefault(value, "base");
            case "color"            -> "text-" + tailwindColor(value);
            case "background-color" -> "bg-" + tailwindColor(value);
            case "margin"           -> "m-" + SPACING_CLASSES.getOrDefault(value, "4");
            case "padding"          -> "p-" + SPACING_CLASSES.getOrDefault(value, "4");
            default                 -> property + "-" + value;
        };
    }

    private String tailwindColor(String color) {
        if (color.startsWith("#")) {
            return "gray-500";
        }
        return color.replaceAll("[^a-zA-Z0-9]", "-");
    }
}
