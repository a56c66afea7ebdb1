package com.editguard.core.prompt;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.confidence.ConfidenceFactors;
import com.editguard.core.impact.CascadeChange;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.DirectChange;
import com.editguard.core.impact.ExpectedScope;
import com.editguard.core.impact.PreservationRule;
import com.editguard.core.impact.ValidationCheck;
import com.editguard.core.repo.ComponentProp;
import com.editguard.core.repo.DesignTokens;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.StylingPatterns;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeCategory;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.PropertyEdit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * ContextualPromptBuilder: renders the generation instruction for a strategy.
 *
 * The more confident the assessment, the more the prompt trusts the generator:
 *   direct       : full repository and component context, apply with established patterns
 *   guided       : adds impact analysis, preservation rules and the checks that will run
 *   conservative : hard line cap, no structural/import/functional change, "prefer no change"
 *   human review : proposal only, original source kept untouched below the commentary
 *
 * Side-effect-free and deterministic: map-backed sections are rendered in sorted key order.
 */
@Component
public class ContextualPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextualPromptBuilder.class);

    private static final int BASE_RESPONSE_TOKENS   = 500;
    private static final int CHARS_PER_TOKEN        = 4;
    private static final int CONSERVATIVE_LINE_CAP  = 5;
    private static final int LISTED_KEYS_LIMIT      = 5;

    // =========================================================================
    // Public API
    // =========================================================================

    /** Renders for the assessment's recommended approach. */
    public GeneratedPrompt build(PromptContext context) {
        return build(context, context.getAssessment().getRecommendedApproach());
    }

    /** Renders for an explicit approach; the execution engine uses this on fallback. */
    public GeneratedPrompt build(PromptContext context, ChangeApproach approach) {
        String content = switch (approach) {
            case HIGH_CONFIDENCE_DIRECT           -> directPrompt(context);
            case MEDIUM_CONFIDENCE_GUIDED         -> guidedPrompt(context);
            case LOW_CONFIDENCE_CONSERVATIVE      -> conservativePrompt(context);
            case VERY_LOW_CONFIDENCE_HUMAN_REVIEW -> humanReviewPrompt(context);
        };

        GeneratedPrompt prompt = new GeneratedPrompt(
                content,
                approach,
                context.getAssessment().getConfidence(),
                estimateTokens(content),
                estimateResponseTokens(context.getImpact().getExpectedScope())
        );

        log.debug("[PromptBuilder] {}", prompt);
        return prompt;
    }

    /**
     * Follow-up prompt for an output that dropped too much of the file.
     * Restates the original in full and asks for it back with only the change applied.
     */
    public GeneratedPrompt buildCorrectionPrompt(PromptContext context, ChangeApproach approach, String previousFailure) {
        String original = context.getComponent().getContent();

        String content = """
                PREVIOUS ATTEMPT FAILED: %s

                ORIGINAL FILE (%d characters):
                ```%s
                %s
                ```

                CHANGE: %s

                INSTRUCTIONS:
                1. Copy the entire file above
                2. Make only the requested change
                3. Return the complete file (must be ~%d characters)

                COMPLETE CORRECTED FILE:""".formatted(
                previousFailure,
                original.length(),
                languageTag(context.getComponent().getFilePath()),
                original,
                context.getRequest().describe(),
                original.length());

        return new GeneratedPrompt(content, approach, context.getAssessment().getConfidence(),
                estimateTokens(content), estimateResponseTokens(context.getImpact().getExpectedScope()));
    }

    // =========================================================================
    // Strategy prompts
    // =========================================================================

    private String directPrompt(PromptContext ctx) {
        String framework = ctx.getRepo().getPrimaryFramework();

        return """
                You are an expert %s developer with deep knowledge of this codebase.

                %s

                %s

                %s

                %s

                %s

                ## INSTRUCTIONS (High Confidence Execution)

                Based on the analysis above, you have high confidence to:

                1. **Apply the visual change precisely**: %s
                2. **Leverage established patterns**: Use the same styling approach and component patterns shown above
                3. **Maintain all functionality**: Preserve all props, exports, imports, and behavior
                4. **Follow framework conventions**: Use %s conventions
                5. **Keep the change targeted**: Do not reformat or restructure unrelated code

                ## EXPECTED OUTCOME
                - Clean, production-ready code
                - Minimal, targeted changes
                - Consistent with codebase patterns
                - Fully functional component

                Return the complete modified file content:""".formatted(
                framework,
                repositoryContext(ctx.getRepo()),
                changeContext(ctx.getRequest(), ctx.getAssessment()),
                componentAnalysis(ctx.getComponent()),
                stylingContext(ctx.getComponent(), ctx.getRepo()),
                currentCode(ctx.getComponent()),
                ctx.getRequest().describe(),
                framework);
    }

    private String guidedPrompt(PromptContext ctx) {
        ExpectedScope scope = ctx.getImpact().getExpectedScope();

        return """
                You are an expert %s developer. Apply this change with guided precision.

                %s

                %s

                %s

                %s

                %s

                %s

                ## GUIDED INSTRUCTIONS (Medium Confidence)

                Follow these guided constraints carefully:

                1. **Scope Limitation**: Expected ~%d lines changed
                2. **Change Type**: %s modification only
                3. **Risk Management**: This is a %s risk change
                4. **Preservation**: Follow all preservation requirements above
                5. **Validation**: Changes will be strictly validated

                ## SPECIFIC REQUIREMENTS
                %s

                ## VALIDATION CHECKS
                Your changes will be validated for:
                %s

                Return the complete modified file content with guided precision:""".formatted(
                ctx.getRepo().getPrimaryFramework(),
                repositoryContext(ctx.getRepo()),
                changeContext(ctx.getRequest(), ctx.getAssessment()),
                impactAnalysis(ctx.getImpact()),
                componentAnalysis(ctx.getComponent()),
                preservationRequirements(ctx.getImpact()),
                currentCode(ctx.getComponent()),
                scope.getExpectedLines(),
                scope.getTier().displayName(),
                scope.getRiskLevel().displayName(),
                specificRequirements(ctx.getRequest()),
                validationChecks(ctx.getImpact()));
    }

    private String conservativePrompt(PromptContext ctx) {
        int maxLines = Math.min(ctx.getImpact().getExpectedScope().getExpectedLines(), CONSERVATIVE_LINE_CAP);

        String critical = bulletList(ctx.getImpact().criticalRules().stream()
                .map(r -> r.getDescription() + " (MUST PRESERVE)")
                .collect(Collectors.toList()), "No critical preservation rules declared; preserve everything");

        return """
                You are an expert %s developer. Apply this change with MAXIMUM CAUTION.

                **LOW CONFIDENCE SCENARIO**
                This change has low confidence (%s). Be extremely conservative.

                %s

                %s

                %s

                ## CRITICAL CONSTRAINTS (Low Confidence)

                **STRICT LIMITATIONS**:
                - Maximum %d lines changed
                - NO structural modifications
                - NO new dependencies or imports
                - NO functionality changes
                - ONLY the minimal change required

                **PRESERVATION REQUIREMENTS** (CRITICAL):
                %s

                %s

                ## CONSERVATIVE INSTRUCTIONS

                1. **Minimal Change Only**: Apply the smallest possible modification
                2. **Preserve Everything**: Keep all existing code structure intact
                3. **No Assumptions**: If unclear, prefer NO change over wrong change
                4. **Exact Match**: Only change what directly relates to: %s
                5. **Safety First**: When in doubt, be more conservative

                ## CHANGE TO APPLY
                %s

                **Remember**: This is a low-confidence scenario. Err on the side of caution.

                Return the complete file with minimal, conservative modifications:""".formatted(
                ctx.getRepo().getPrimaryFramework(),
                percent(ctx.getAssessment().getConfidence()),
                repositoryContext(ctx.getRepo()),
                changeContext(ctx.getRequest(), ctx.getAssessment()),
                componentAnalysis(ctx.getComponent()),
                maxLines,
                critical,
                currentCode(ctx.getComponent()),
                ctx.getRequest().describe(),
                minimalChangeDescription(ctx.getRequest()));
    }

    private String humanReviewPrompt(PromptContext ctx) {
        return """
                You are an expert %s developer creating a change proposal for human review.

                ## CHANGE PROPOSAL GENERATION

                This change has very low confidence (%s) and requires human review.

                %s

                %s

                %s

                ## CONFIDENCE FACTORS
                %s

                %s

                ## INSTRUCTIONS (Proposal Generation)

                Create a detailed change proposal that includes:

                1. **Analysis Summary**: What you understand about the change
                2. **Proposed Approach**: How you would implement it
                3. **Risk Assessment**: What could go wrong
                4. **Alternative Options**: Different ways to implement
                5. **Recommendation**: Your suggested approach

                Format as comments in the code with the original code preserved below.
                Do NOT modify the original code.

                Return a proposal document with the original code intact:""".formatted(
                ctx.getRepo().getPrimaryFramework(),
                percent(ctx.getAssessment().getConfidence()),
                repositoryContext(ctx.getRepo()),
                changeContext(ctx.getRequest(), ctx.getAssessment()),
                componentAnalysis(ctx.getComponent()),
                confidenceFactors(ctx.getAssessment()),
                currentCode(ctx.getComponent()));
    }

    // =========================================================================
    // Sections
    // =========================================================================

    private String repositoryContext(RepoContext repo) {
        return """
                ## REPOSITORY CONTEXT

                **Framework**: %s %s
                **Styling System**: %s
                **Components**: %d analyzed components
                **Design System**: %s
                **Analysis Confidence**: %s
                **Naming Convention**: %s

                **Styling Patterns**:
                %s""".formatted(
                repo.getPrimaryFramework(),
                repo.getFrameworkVersion(),
                repo.getStylingApproach().displayName(),
                repo.componentCount(),
                repo.hasDesignTokens() ? "Available" : "Not detected",
                percent(repo.getAnalysisConfidence()),
                repo.getNamingConvention(),
                stylingPatterns(repo));
    }

    private String stylingPatterns(RepoContext repo) {
        if (!repo.hasStylingPatterns()) {
            return "- No specific patterns detected";
        }
        StylingPatterns patterns = repo.getStylingPatterns().orElseThrow();
        List<String> lines = new ArrayList<>();
        if (!patterns.getFontSizes().isEmpty()) lines.add("- Font Sizes: " + firstKeys(patterns.getFontSizes()));
        if (!patterns.getColors().isEmpty())    lines.add("- Colors: "     + firstKeys(patterns.getColors()));
        if (!patterns.getSpacing().isEmpty())   lines.add("- Spacing: "    + firstKeys(patterns.getSpacing()));
        return String.join("\n", lines);
    }

    private String changeContext(ChangeRequest request, ChangeConfidenceAssessment assessment) {
        String edits = bulletList(request.getEdits().stream()
                .map(e -> String.format("**%s**: `%s` → `%s` (%s)",
                        e.getProperty(), e.getBefore(), e.getAfter(), e.getCategory().name().toLowerCase()))
                .collect(Collectors.toList()), "No specific visual changes defined");

        return """
                ## CHANGE CONTEXT (Confidence: %s)

                **Intent**: %s
                **Type**: %s
                **Risk Level**: %s
                **Approach**: %s

                **Visual Changes**:
                %s

                **Target Element**: %s""".formatted(
                percent(assessment.getConfidence()),
                request.describe(),
                request.primaryCategory().name().toLowerCase(),
                assessment.getRiskLevel().displayName(),
                assessment.getRecommendedApproach(),
                edits,
                request.getElement());
    }

    private String componentAnalysis(TargetComponent component) {
        List<ComponentProp> props = component.getProps();
        String propLines = props.isEmpty()
                ? ""
                : "\n" + props.stream().map(p -> "- " + p).collect(Collectors.joining("\n"));

        return """
                ## COMPONENT ANALYSIS

                **Component**: %s
                **File**: %s
                **Complexity**: %s
                **Framework**: %s

                **Styling Approach**: %s
                **CSS Classes**: %s
                **Inline Styles**: %s

                **Props**: %d defined%s

                **Exports**: %s
                **Imports**: %d dependencies""".formatted(
                component.getName(),
                component.getFilePath(),
                component.getComplexity().name().toLowerCase(),
                component.getFramework(),
                component.getStylingApproach().displayName(),
                component.getCssClasses().isEmpty() ? "None detected" : String.join(", ", component.getCssClasses()),
                component.hasInlineStyles() ? "Yes" : "No",
                props.size(),
                propLines,
                component.getExports().isEmpty() ? "default" : String.join(", ", component.getExports()),
                component.getImports().size());
    }

    private String stylingContext(TargetComponent component, RepoContext repo) {
        StringBuilder sb = new StringBuilder();
        sb.append("## STYLING CONTEXT\n\n**Approach**: ").append(component.getStylingApproach().displayName()).append("\n");

        if (repo.hasDesignTokens()) {
            DesignTokens tokens = repo.getDesignTokens().orElseThrow();
            sb.append("\n**Design Tokens Available**:\n");
            if (!tokens.getColors().isEmpty())     sb.append("- Colors: ").append(firstKeys(tokens.getColors())).append("\n");
            if (!tokens.getSpacing().isEmpty())    sb.append("- Spacing: ").append(firstKeys(tokens.getSpacing())).append("\n");
            if (!tokens.getTypography().isEmpty()) sb.append("- Typography: ").append(firstKeys(tokens.getTypography())).append("\n");
        }

        if (!repo.getCssVariables().isEmpty()) {
            sb.append("\n**CSS Variables**: ").append(firstKeys(repo.getCssVariables())).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    private String impactAnalysis(ChangeImpactAnalysis impact) {
        ExpectedScope scope = impact.getExpectedScope();

        StringBuilder sb = new StringBuilder();
        sb.append("## IMPACT ANALYSIS\n\n");
        sb.append("**Expected Scope**: ").append(scope.getTier().displayName())
          .append(" (").append(scope.getExpectedLines()).append(" lines)\n");
        sb.append("**Risk Level**: ").append(scope.getRiskLevel().displayName()).append("\n\n");

        sb.append("**Direct Changes**: ").append(impact.getDirectChanges().size()).append("\n");
        for (DirectChange change : impact.getDirectChanges()) {
            sb.append(String.format("- %s: %s (confidence: %.0f%%)\n",
                    change.getType(), change.getProperty(), change.getConfidence() * 100));
        }

        sb.append("\n**Cascade Changes**: ").append(impact.getCascadeChanges().size()).append("\n");
        for (CascadeChange change : impact.getCascadeChanges()) {
            sb.append("- ").append(change.getType()).append(": ").append(change.getReason())
              .append(change.isRequired() ? " (required)" : " (optional)").append("\n");
        }
        return sb.toString().stripTrailing();
    }

    private String preservationRequirements(ChangeImpactAnalysis impact) {
        StringBuilder sb = new StringBuilder("## PRESERVATION REQUIREMENTS\n");

        List<PreservationRule> critical  = impact.criticalRules();
        List<PreservationRule> important = impact.importantRules();

        if (!critical.isEmpty()) {
            sb.append("\n**CRITICAL (Must Preserve)**:\n");
            critical.forEach(r -> sb.append("- ").append(r.getDescription()).append("\n"));
        }
        if (!important.isEmpty()) {
            sb.append("\n**Important**:\n");
            important.forEach(r -> sb.append("- ").append(r.getDescription()).append("\n"));
        }
        if (critical.isEmpty() && important.isEmpty()) {
            sb.append("\n- Preserve all existing functionality\n");
        }
        return sb.toString().stripTrailing();
    }

    private String currentCode(TargetComponent component) {
        String content = component.hasContent() ? component.getContent() : "// No content available";
        return """
                ## CURRENT CODE

                **File**: %s

                ```%s
                %s
                ```""".formatted(component.getFilePath(), languageTag(component.getFilePath()), content);
    }

    private String specificRequirements(ChangeRequest request) {
        List<String> requirements = new ArrayList<>();

        ChangeCategory category = request.primaryCategory();
        if (category == ChangeCategory.STYLING) {
            requirements.add("Focus only on styling properties");
            requirements.add("Do not modify component structure");
        } else if (category == ChangeCategory.LAYOUT) {
            requirements.add("Modify layout properties carefully");
            requirements.add("Consider responsive implications");
        }

        for (PropertyEdit edit : request.getEdits()) {
            if (edit.isFontSizeLike()) {
                requirements.add("Update font-size property only");
                requirements.add("Consider line-height adjustments if needed");
            } else if (edit.getProperty().equalsIgnoreCase("color")) {
                requirements.add("Update color property only");
                requirements.add("Ensure sufficient contrast");
            }
        }
        return bulletList(requirements, "Apply only the requested change");
    }

    private String validationChecks(ChangeImpactAnalysis impact) {
        return bulletList(impact.getValidationChecks().stream().map(ValidationCheck::getDescription).collect(Collectors.toList()),
                "Syntax, intent alignment, preservation and change scope");
    }

    private String minimalChangeDescription(ChangeRequest request) {
        if (request.getEdits().isEmpty()) {
            return "Apply: " + request.describe();
        }
        return request.getEdits().stream()
                .map(e -> String.format("**%s**: Change from `%s` to `%s` ONLY", e.getProperty(), e.getBefore(), e.getAfter()))
                .collect(Collectors.joining("\n"));
    }

    private String confidenceFactors(ChangeConfidenceAssessment assessment) {
        ConfidenceFactors f = assessment.getFactors();
        String fallbacks = assessment.getFallbackApproaches().isEmpty()
                ? "none"
                : assessment.getFallbackApproaches().stream().map(ChangeApproach::getId).collect(Collectors.joining(", "));

        return """
                **Visual Clarity**: %.0f%% - %s
                **Component Understanding**: %.0f%% - %s
                **Change Complexity**: %.0f%% - %s
                **Context Completeness**: %.0f%% - %s

                **Overall Risk**: %s
                **Fallback Strategies**: %s""".formatted(
                f.getVisualClarity() * 100,          FactorDescriptions.visual(f.getVisualClarity()),
                f.getComponentUnderstanding() * 100, FactorDescriptions.component(f.getComponentUnderstanding()),
                f.getChangeComplexity() * 100,       FactorDescriptions.complexity(f.getChangeComplexity()),
                f.getContextCompleteness() * 100,    FactorDescriptions.context(f.getContextCompleteness()),
                assessment.getRiskLevel().displayName(),
                fallbacks);
    }

    // =========================================================================
    // Estimates and helpers
    // =========================================================================

    static int estimateTokens(String content) {
        return (content.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    static int estimateResponseTokens(ExpectedScope scope) {
        return BASE_RESPONSE_TOKENS * scope.getTier().getResponseMultiplier();
    }

    static String languageTag(String filePath) {
        int dot = filePath.lastIndexOf('.');
        String ext = dot >= 0 ? filePath.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return switch (ext) {
            case "tsx" -> "tsx";
            case "jsx" -> "jsx";
            case "ts"  -> "typescript";
            case "vue" -> "vue";
            default    -> "javascript";
        };
    }

    private static String firstKeys(Map<String, ?> map) {
        Collection<String> sorted = new TreeSet<>(map.keySet());
        String listed = sorted.stream().limit(LISTED_KEYS_LIMIT).collect(Collectors.joining(", "));
        return sorted.size() > LISTED_KEYS_LIMIT ? listed + "..." : listed;
    }

    private static String bulletList(List<String> items, String whenEmpty) {
        if (items.isEmpty()) {
            return "- " + whenEmpty;
        }
        return items.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
    }

    private static String percent(double value) {
        return String.format("%.1f%%", value * 100);
    }
}
