package com.editguard.orchestrator;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.confidence.ConfidenceFactors;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.DirectChange;
import com.editguard.core.impact.RiskLevel;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an assessment and its impact analysis into dry-run bullet lists.
 * Each list is never empty: a quiet change still gets one reassuring line.
 */
@Component
public class PreviewAdvisor {

    public DryRunPreview preview(ChangeConfidenceAssessment assessment, ChangeImpactAnalysis impact) {
        List<String> changes         = expectedChanges(impact);
        List<String> risks           = risks(assessment);
        List<String> recommendations = recommendations(assessment, impact);
        return new DryRunPreview(assessment, impact, changes, risks, recommendations,
                render(assessment, changes, risks, recommendations));
    }

    List<String> expectedChanges(ChangeImpactAnalysis impact) {
        List<String> changes = new ArrayList<>();
        changes.add(String.format("%s change affecting ~%d lines",
                impact.getExpectedScope().getTier().displayName(),
                impact.getExpectedScope().getExpectedLines()));

        for (DirectChange change : impact.getDirectChanges()) {
            changes.add(change.getType().name().toLowerCase().replace('_', '-')
                    + " modification: " + change.getTarget());
        }

        long required = impact.requiredCascadeCount();
        if (required > 0) {
            changes.add(required + " related changes required");
        }
        return changes;
    }

    List<String> risks(ChangeConfidenceAssessment assessment) {
        List<String>      risks   = new ArrayList<>();
        ConfidenceFactors factors = assessment.getFactors();

        if (assessment.getRiskLevel().isAtLeast(RiskLevel.HIGH)) {
            risks.add(assessment.getRiskLevel().displayName() + " risk change");
        }
        if (assessment.getConfidence() < 0.6) {
            risks.add("Low confidence in change execution");
        }
        if (factors.getVisualClarity() < 0.5) {
            risks.add("Unclear visual intent");
        }
        if (factors.getComponentUnderstanding() < 0.5) {
            risks.add("Limited component understanding");
        }
        if (risks.isEmpty()) {
            risks.add("Low risk change");
        }
        return risks;
    }

    List<String> recommendations(ChangeConfidenceAssessment assessment, ChangeImpactAnalysis impact) {
        List<String> recommendations = new ArrayList<>();

        if (assessment.getConfidence() < 0.5) {
            recommendations.add("Consider providing more specific visual guidance");
        }
        if (impact.getExpectedScope().getRiskLevel().isAtLeast(RiskLevel.HIGH)) {
            recommendations.add("Consider breaking this into smaller changes");
        }
        if (assessment.getFactors().getContextCompleteness() < 0.7) {
            recommendations.add("Repository analysis could be improved for better results");
        }
        if (assessment.getRecommendedApproach() == ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW) {
            recommendations.add("Human review is recommended before applying changes");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Change is ready for execution");
        }
        return recommendations;
    }

    private static String render(ChangeConfidenceAssessment assessment,
                                 List<String> changes,
                                 List<String> risks,
                                 List<String> recommendations) {
        StringBuilder sb = new StringBuilder();
        sb.append("DRY RUN ANALYSIS\n");
        sb.append("================\n");
        sb.append(String.format("Confidence : %.1f%%", assessment.getConfidence() * 100)).append("\n");
        sb.append("Approach   : ").append(assessment.getRecommendedApproach().getId()).append("\n");
        sb.append("Risk level : ").append(assessment.getRiskLevel().displayName()).append("\n\n");
        appendList(sb, "Expected changes", changes);
        appendList(sb, "Risks", risks);
        appendList(sb, "Recommendations", recommendations);
        sb.append("Ready to execute with ").append(assessment.getRecommendedApproach().getId()).append(" approach.");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, List<String> items) {
        sb.append(title).append(":\n");
        for (String item : items) {
            sb.append("  - ").append(item).append("\n");
        }
        sb.append("\n");
    }
}
