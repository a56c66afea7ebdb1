package com.editguard.core.validation;

import com.editguard.config.PipelineSettings;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.PreservationRule;
import com.editguard.core.impact.RiskLevel;
import com.editguard.core.repo.StylingApproach;
import com.editguard.core.request.ChangeCategory;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.PropertyEdit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ValidationEngine: decides whether proposed content is safe to ship.
 *
 * Five checks run on every call and are aggregated, never short-circuited:
 *   1. syntax sanity         (SyntaxHeuristics)
 *   2. intent alignment      (IntentReflectionStrategy per styling approach)
 *   3. preservation rules    (critical → exact multiplicity, otherwise ≥1 occurrence)
 *   4. scope / over-deletion (per-category ceilings scaled by ValidationLevel)
 *   5. confidence limits     (tighter caps below 0.5 confidence)
 *
 * Checks 1–3 can be switched off through {@link PipelineSettings}; a skipped check
 * leaves an INFO issue behind. Checks 4 and 5 always run.
 *
 * Pure computation over text. No I/O.
 */
@Component
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private static final int    FONT_SIZE_MAX_REMOVED      = 5;
    private static final int    STYLING_LINES_WARNING      = 10;
    private static final double LOW_CONFIDENCE             = 0.5;
    private static final double LOW_CONFIDENCE_MAX_RATIO   = 0.3;
    private static final int    LOW_CONFIDENCE_MAX_REMOVED = 10;
    private static final int    HIGH_RISK_COMPLEXITY_DELTA = 5;

    private final PipelineSettings               settings;
    private final List<IntentReflectionStrategy> reflectionStrategies;

    public ValidationEngine(PipelineSettings settings, List<IntentReflectionStrategy> reflectionStrategies) {
        this.settings             = settings;
        this.reflectionStrategies = List.copyOf(reflectionStrategies);
    }

    // =========================================================================
    // Entry points
    // =========================================================================

    /** Validates without knowing the styling approach: every reflection strategy is consulted. */
    public ValidationResult validate(String                     originalContent,
                                     String                     proposedContent,
                                     ChangeRequest              request,
                                     ChangeConfidenceAssessment assessment,
                                     ChangeImpactAnalysis       impact) {
        return validate(originalContent, proposedContent, request, assessment, impact, null);
    }

    public ValidationResult validate(String                     originalContent,
                                     String                     proposedContent,
                                     ChangeRequest              request,
                                     ChangeConfidenceAssessment assessment,
                                     ChangeImpactAnalysis       impact,
                                     StylingApproach            stylingApproach) {

        String original = originalContent != null ? originalContent : "";
        String proposed = proposedContent != null ? proposedContent : "";

        List<ValidationIssue>   issues   = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        ValidationMetrics metrics = ValidationMetrics.compute(original, proposed);
        ValidationLevel   level   = ValidationLevel.forAssessment(assessment);

        if (settings.isSyntaxCheckEnabled()) {
            issues.addAll(SyntaxHeuristics.check(proposed));
        } else {
            issues.add(ValidationIssue.info(IssueType.SYNTAX, "Syntax check disabled by configuration"));
        }

        if (settings.isIntentCheckEnabled()) {
            checkIntent(proposed, request, level, stylingApproach, issues, warnings);
        } else {
            issues.add(ValidationIssue.info(IssueType.INTENT_MISMATCH, "Intent check disabled by configuration"));
        }

        if (settings.isPreservationCheckEnabled()) {
            checkPreservation(original, proposed, impact, issues, warnings);
        } else {
            issues.add(ValidationIssue.info(IssueType.PRESERVATION_VIOLATION,
                    "Preservation check disabled by configuration"));
        }

        checkScope(request, metrics, level, issues, warnings);
        checkConfidenceLimits(assessment, metrics, issues, warnings);

        double confidence = aggregateConfidence(assessment.getConfidence(), issues, warnings, metrics);
        ValidationResult result = new ValidationResult(confidence, issues, warnings, metrics, level);

        if (result.isPassed()) {
            log.info("[Validation] PASSED level={} {} warnings={}", level, metrics, warnings.size());
        } else {
            log.warn("[Validation] FAILED level={} {} errors={}", level, metrics, result.errors().size());
            result.errors().forEach(e -> log.debug("[Validation]   {}", e));
        }
        return result;
    }

    // =========================================================================
    // Check 2: intent alignment
    // =========================================================================

    private void checkIntent(String proposed, ChangeRequest request, ValidationLevel level,
                             StylingApproach approach,
                             List<ValidationIssue> issues, List<ValidationWarning> warnings) {

        for (PropertyEdit edit : request.getEdits()) {
            boolean reflected = reflectionStrategies.stream()
                    .filter(s -> approach == null || s.supports(approach))
                    .anyMatch(s -> s.isReflected(proposed, edit));

            if (reflected) continue;

            String message = String.format("Visual change not reflected in code: %s \"%s\" → \"%s\"",
                    edit.getProperty(), edit.getBefore(), edit.getAfter());
            String suggestion = String.format("Ensure the %s change to \"%s\" is reflected in the code",
                    edit.getProperty(), edit.getAfter());

            if (level == ValidationLevel.PARANOID) {
                issues.add(ValidationIssue.error(IssueType.INTENT_MISMATCH, message, suggestion));
            } else {
                warnings.add(new ValidationWarning(ValidationWarning.Type.INTENT_ALIGNMENT, message, suggestion));
            }
        }
    }

    // =========================================================================
    // Check 3: preservation
    // =========================================================================

    private void checkPreservation(String original, String proposed, ChangeImpactAnalysis impact,
                                   List<ValidationIssue> issues, List<ValidationWarning> warnings) {

        for (PreservationRule rule : impact.getPreservationRules()) {
            int before = rule.countOccurrences(original);
            int after  = rule.countOccurrences(proposed);

            boolean preserved = rule.isCritical() ? before == after : after > 0;
            if (preserved) continue;

            String message = rule.isCritical()
                    ? String.format("Preservation rule violated: %s (%d occurrence(s) before, %d after)",
                            rule.getDescription(), before, after)
                    : "Preservation rule violated: " + rule.getDescription();
            String suggestion = "Ensure " + rule.getDescription().toLowerCase() + " are maintained in the code";

            if (rule.isCritical()) {
                issues.add(ValidationIssue.error(IssueType.PRESERVATION_VIOLATION, message, suggestion));
            } else {
                warnings.add(new ValidationWarning(ValidationWarning.Type.PRESERVATION, message, suggestion));
            }
        }
    }

    // =========================================================================
    // Check 4: scope / over-deletion
    // =========================================================================

    private void checkScope(ChangeRequest request, ValidationMetrics metrics, ValidationLevel level,
                            List<ValidationIssue> issues, List<ValidationWarning> warnings) {

        ChangeCategory category = request.primaryCategory();

        int deletionCeiling = level.deletionCeiling(category);
        if (metrics.getLinesRemoved() > deletionCeiling) {
            issues.add(ValidationIssue.error(IssueType.SCOPE_EXCEEDED,
                    String.format("Excessive code deletion detected: %d lines removed (threshold: %d)",
                            metrics.getLinesRemoved(), deletionCeiling),
                    "Review the change to ensure only necessary code is being removed"));
        }

        double ratioCeiling = level.changeRatioCeiling(category);
        if (metrics.getChangeRatio() > ratioCeiling) {
            String message = String.format("Change ratio exceeded: %.1f%% of file changed (threshold: %.1f%%)",
                    metrics.getChangeRatio() * 100, ratioCeiling * 100);
            String suggestion = "Consider if such a large change is necessary for the visual intent";

            if (level == ValidationLevel.PARANOID) {
                issues.add(ValidationIssue.error(IssueType.SCOPE_EXCEEDED, message, suggestion));
            } else {
                warnings.add(new ValidationWarning(ValidationWarning.Type.SCOPE, message, suggestion));
            }
        }

        if (category == ChangeCategory.STYLING && metrics.getLinesChanged() > STYLING_LINES_WARNING) {
            warnings.add(new ValidationWarning(ValidationWarning.Type.SCOPE,
                    String.format("Simple styling change resulted in %d lines changed", metrics.getLinesChanged()),
                    "Verify this change scope is appropriate for a styling modification"));
        }

        if (request.touchesFontSize() && metrics.getLinesRemoved() > FONT_SIZE_MAX_REMOVED) {
            issues.add(ValidationIssue.error(IssueType.SCOPE_EXCEEDED,
                    String.format("Font size change should not remove %d lines of code", metrics.getLinesRemoved()),
                    "Font size changes should be minimal and targeted"));
        }
    }

    // =========================================================================
    // Check 5: confidence-proportional limits
    // =========================================================================

    private void checkConfidenceLimits(ChangeConfidenceAssessment assessment, ValidationMetrics metrics,
                                       List<ValidationIssue> issues, List<ValidationWarning> warnings) {

        double confidence = assessment.getConfidence();
        if (confidence < LOW_CONFIDENCE) {
            if (metrics.getChangeRatio() > LOW_CONFIDENCE_MAX_RATIO) {
                issues.add(ValidationIssue.error(IssueType.SCOPE_EXCEEDED,
                        String.format("Low confidence change (%.1f%%) with high change ratio (%.1f%%)",
                                confidence * 100, metrics.getChangeRatio() * 100),
                        "Use a more conservative approach for low confidence changes"));
            }
            if (metrics.getLinesRemoved() > LOW_CONFIDENCE_MAX_REMOVED) {
                issues.add(ValidationIssue.error(IssueType.SCOPE_EXCEEDED,
                        String.format("Low confidence change should not remove %d lines", metrics.getLinesRemoved()),
                        "Reduce the scope of changes for low confidence scenarios"));
            }
        }

        if (assessment.getRiskLevel().isAtLeast(RiskLevel.HIGH)
                && metrics.getComplexityDelta() > HIGH_RISK_COMPLEXITY_DELTA) {
            warnings.add(new ValidationWarning(ValidationWarning.Type.COMPLEXITY,
                    "High-risk change increases complexity significantly",
                    "Consider breaking this into smaller, safer changes"));
        }
    }

    // =========================================================================
    // Aggregation
    // =========================================================================

    private double aggregateConfidence(double input, List<ValidationIssue> issues,
                                       List<ValidationWarning> warnings, ValidationMetrics metrics) {
        long errors = issues.stream().filter(ValidationIssue::isError).count();

        double confidence = input;
        confidence -= errors * 0.2;
        confidence -= warnings.size() * 0.05;
        if (metrics.getChangeRatio() > 0.5) {
            confidence -= 0.2;
        }
        return Math.max(0.1, confidence);
    }
}
