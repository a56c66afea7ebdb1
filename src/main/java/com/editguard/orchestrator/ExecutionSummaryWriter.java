package com.editguard.orchestrator;

import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.confidence.ConfidenceFactors;
import com.editguard.core.execution.ExecutionResult;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.validation.ValidationIssue;
import com.editguard.core.validation.ValidationMetrics;
import com.editguard.core.validation.ValidationResult;
import com.editguard.core.validation.ValidationWarning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders the human-readable summary attached to every ReasoningResult.
 *
 * Always names the strategy used, the confidence breakdown and the change
 * metrics. Failed runs list every error with its suggestion.
 */
@Component
public class ExecutionSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionSummaryWriter.class);

    public String write(ChangeRequest              request,
                        ChangeConfidenceAssessment assessment,
                        ChangeImpactAnalysis       impact,
                        ExecutionResult            execution) {

        ValidationResult  validation = execution.getValidation();
        ValidationMetrics metrics    = validation.getMetrics();

        StringBuilder sb = new StringBuilder();
        sb.append("EXECUTION SUMMARY\n");
        sb.append("=================\n\n");

        sb.append("CHANGE REQUEST\n");
        sb.append("  Intent  : ").append(request.describe()).append("\n");
        sb.append("  Type    : ").append(request.primaryCategory()).append("\n");
        sb.append("  Target  : ").append(request.getElement()).append("\n\n");

        appendAssessment(sb, assessment);

        sb.append("IMPACT ANALYSIS\n");
        sb.append("  Expected scope  : ").append(impact.getExpectedScope().getTier().displayName()).append("\n");
        sb.append("  Expected lines  : ").append(impact.getExpectedScope().getExpectedLines()).append("\n");
        sb.append("  Direct changes  : ").append(impact.getDirectChanges().size()).append("\n");
        sb.append("  Cascade changes : ").append(impact.getCascadeChanges().size()).append("\n\n");

        sb.append("EXECUTION RESULTS\n");
        sb.append("  Strategy        : ").append(execution.getStrategyUsed().getId()).append("\n");
        sb.append("  Attempts        : ").append(execution.attemptCount()).append("\n");
        sb.append("  Files modified  : ").append(execution.getFileChanges().size()).append("\n");
        sb.append("  Validation      : ").append(validation.isPassed() ? "PASSED" : "FAILED")
          .append(" (").append(validation.getLevel()).append(")\n");
        sb.append("  Lines changed   : ").append(metrics.getLinesChanged()).append("\n");
        sb.append("  Lines added     : ").append(metrics.getLinesAdded()).append("\n");
        sb.append("  Lines removed   : ").append(metrics.getLinesRemoved()).append("\n");
        sb.append(String.format("  Change ratio    : %.1f%%", metrics.getChangeRatio() * 100)).append("\n");
        sb.append(String.format("  Validation conf : %.1f%%", validation.getConfidence() * 100)).append("\n\n");

        if (!validation.errors().isEmpty()) {
            sb.append("ISSUES FOUND\n");
            for (ValidationIssue issue : validation.errors()) {
                sb.append("  - ").append(issue.getType()).append(": ").append(issue.getMessage()).append("\n");
                issue.getSuggestion().ifPresent(s -> sb.append("    Suggestion: ").append(s).append("\n"));
            }
            sb.append("\n");
        }

        if (!validation.getWarnings().isEmpty()) {
            sb.append("WARNINGS\n");
            for (ValidationWarning warning : validation.getWarnings()) {
                sb.append("  - ").append(warning.getType()).append(": ").append(warning.getMessage()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("OUTCOME\n");
        if (!validation.isPassed()) {
            sb.append("  Change validation failed - ").append(validation.errors().size())
              .append(" critical issue(s) found");
        } else if (execution.isProposal()) {
            sb.append("  Change proposal ready for human review");
        } else {
            sb.append("  Change executed successfully with ").append(execution.getStrategyUsed().getId())
              .append(" approach");
        }

        String summary = sb.toString();
        log.debug("[Summary] {}", summary);
        return summary;
    }

    /** Summary for a run that stopped at a fatal stage error. */
    public String writeFailure(ChangeRequest request, ChangeConfidenceAssessment assessment,
                               String stage, String error) {
        StringBuilder sb = new StringBuilder();
        sb.append("EXECUTION SUMMARY\n");
        sb.append("=================\n\n");
        sb.append("CHANGE REQUEST\n");
        sb.append("  Intent  : ").append(request.describe()).append("\n\n");
        if (assessment != null) {
            appendAssessment(sb, assessment);
        }
        sb.append("OUTCOME\n");
        sb.append("  Pipeline failed at ").append(stage).append(": ").append(error);
        return sb.toString();
    }

    private static void appendAssessment(StringBuilder sb, ChangeConfidenceAssessment assessment) {
        ConfidenceFactors f = assessment.getFactors();
        sb.append("CONFIDENCE ASSESSMENT\n");
        sb.append(String.format("  Confidence : %.1f%%", assessment.getConfidence() * 100)).append("\n");
        sb.append("  Approach   : ").append(assessment.getRecommendedApproach().getId()).append("\n");
        sb.append("  Risk level : ").append(assessment.getRiskLevel().displayName()).append("\n");
        sb.append(String.format("  - Visual clarity          : %.0f%%", f.getVisualClarity() * 100)).append("\n");
        sb.append(String.format("  - Component understanding : %.0f%%", f.getComponentUnderstanding() * 100)).append("\n");
        sb.append(String.format("  - Change simplicity       : %.0f%%", f.getChangeComplexity() * 100)).append("\n");
        sb.append(String.format("  - Context completeness    : %.0f%%", f.getContextCompleteness() * 100)).append("\n\n");
    }
}
