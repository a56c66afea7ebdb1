package com.editguard.core.confidence;

import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.ExpectedScope;
import com.editguard.core.impact.RiskLevel;
import com.editguard.core.repo.ComplexityTier;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.TargetElement;
import com.editguard.core.validation.ValidationLevel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ConfidenceEngine: scores how well-understood a requested change is.
 *
 * Pure function of its inputs: no I/O, no state, no mutation. Calling
 * {@link #assess} twice with the same arguments yields equal assessments.
 *
 * Factors (each clamped to [0,1]):
 *   visual clarity         : how precisely the request says what to change
 *   component understanding: how well the target component is known
 *   change complexity      : scored as simplicity, from the impact analysis
 *   context completeness   : how mature the repository model is
 *
 * Overall = 0.30·visual + 0.30·component + 0.25·simplicity + 0.15·context,
 * clamped to [0.1, 1.0].
 */
@Component
public class ConfidenceEngine {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceEngine.class);

    public static final double MIN_CONFIDENCE = 0.1;
    public static final double MAX_CONFIDENCE = 1.0;

    private static final int MEANINGFUL_DESCRIPTION_LENGTH = 20;
    private static final int MATURE_REPO_COMPONENTS        = 50;
    private static final int KNOWN_REPO_COMPONENTS         = 10;

    private static final Pattern PROPERTY_FAMILY = Pattern.compile(
            "font|color|colour|size|spacing|margin|padding|background|border|width|height|layout|align",
            Pattern.CASE_INSENSITIVE);

    // =========================================================================
    // Assessment
    // =========================================================================

    public ChangeConfidenceAssessment assess(ChangeRequest        request,
                                             ChangeImpactAnalysis impact,
                                             TargetComponent      component,
                                             RepoContext          repo) {

        ConfidenceFactors factors = new ConfidenceFactors(
                visualClarity(request),
                componentUnderstanding(component, repo),
                changeSimplicity(impact),
                contextCompleteness(repo)
        );

        double         confidence = overallConfidence(factors);
        ChangeApproach approach   = selectApproach(confidence, impact.getExpectedScope());
        List<ChangeApproach> fallbacks = fallbacksFor(approach, factors);
        RiskLevel      risk       = adjustRisk(confidence, impact);

        log.info("[Confidence] request={} confidence={} approach={} risk={}",
                request.getRequestId(), String.format("%.2f", confidence), approach, risk);
        log.debug("[Confidence] {} fallbacks={}", factors, fallbacks);

        return new ChangeConfidenceAssessment(factors, confidence, approach, fallbacks, risk);
    }

    // =========================================================================
    // Factor scoring
    // =========================================================================

    double visualClarity(ChangeRequest request) {
        double clarity = 0.5;

        String description = request.getIntentDescription();
        if (description.length() > MEANINGFUL_DESCRIPTION_LENGTH
                && PROPERTY_FAMILY.matcher(description).find()) {
            clarity += 0.2;
        }

        int edits = request.getEdits().size();
        if (edits > 0) {
            clarity += 0.2;
            if (edits == 1) clarity += 0.1;
        }

        TargetElement element = request.getElement();
        if (element.hasSelector()) {
            clarity += 0.1;
            if (element.isSpecificSelector()) clarity += 0.1;
        }

        return clamp(clarity);
    }

    double componentUnderstanding(TargetComponent component, RepoContext repo) {
        double understanding = 0.3;

        understanding += switch (component.getComplexity()) {
            case SIMPLE   -> 0.4;
            case MODERATE -> 0.2;
            case COMPLEX  -> 0.0;
        };

        if (component.getStylingApproach().isLowAmbiguity()) understanding += 0.2;
        if (!component.getProps().isEmpty())                 understanding += 0.1;
        if (!component.getExports().isEmpty())               understanding += 0.1;
        if (repo.componentCount() > MATURE_REPO_COMPONENTS)  understanding += 0.1;

        return clamp(understanding);
    }

    double changeSimplicity(ChangeImpactAnalysis impact) {
        double simplicity = 0.8;

        int direct = impact.getDirectChanges().size();
        if (direct > 3) {
            simplicity -= 0.2;
        } else if (direct > 1) {
            simplicity -= 0.1;
        }

        if (impact.hasRequiredCascade()) simplicity -= 0.3;

        ExpectedScope scope = impact.getExpectedScope();
        simplicity -= scope.getTier().getSimplicityPenalty();
        simplicity -= scope.getRiskLevel().simplicityPenalty();

        return Math.max(0.1, clamp(simplicity));
    }

    double contextCompleteness(RepoContext repo) {
        double completeness = 0.4;

        completeness += Math.min(0.3, repo.componentCount() / 100.0 * 0.3);

        if (repo.componentCount() > KNOWN_REPO_COMPONENTS)  completeness += 0.1;
        if (repo.hasDesignTokens())                         completeness += 0.1;
        if (repo.hasStylingPatterns())                      completeness += 0.1;
        if (!repo.getDomMappings().isEmpty())               completeness += 0.1;
        if (!repo.getTransformationRules().isEmpty())       completeness += 0.1;

        return clamp(completeness);
    }

    private double overallConfidence(ConfidenceFactors factors) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, factors.weightedSum()));
    }

    // =========================================================================
    // Strategy selection
    // =========================================================================

    /**
     * Direct needs low risk; guided rejects high and critical risk. Risk only ever
     * pushes the choice toward a more conservative approach.
     */
    private ChangeApproach selectApproach(double confidence, ExpectedScope scope) {
        RiskLevel risk = scope.getRiskLevel();

        if (confidence >= ChangeApproach.HIGH_CONFIDENCE_DIRECT.getThreshold() && risk == RiskLevel.LOW) {
            return ChangeApproach.HIGH_CONFIDENCE_DIRECT;
        }
        if (confidence >= ChangeApproach.MEDIUM_CONFIDENCE_GUIDED.getThreshold() && !risk.isAtLeast(RiskLevel.HIGH)) {
            return ChangeApproach.MEDIUM_CONFIDENCE_GUIDED;
        }
        if (confidence >= ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE.getThreshold()) {
            return ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE;
        }
        return ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW;
    }

    /**
     * Unclear intent always gets human review appended, even when the chain would not reach it.
     * Visual clarity scoring starts at 0.5, so only externally supplied factors trigger this today.
     */
    List<ChangeApproach> fallbacksFor(ChangeApproach approach, ConfidenceFactors factors) {
        List<ChangeApproach> fallbacks = new ArrayList<>(approach.standardFallbacks());

        if (factors.getVisualClarity() < 0.5
                && approach != ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW
                && !fallbacks.contains(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW)) {
            fallbacks.add(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW);
        }
        return fallbacks;
    }

    /**
     * Applied in order, each at most once, starting from the impact analysis's risk:
     * low confidence bumps, high confidence relaxes, more than two required cascades bump.
     */
    private RiskLevel adjustRisk(double confidence, ChangeImpactAnalysis impact) {
        RiskLevel risk = impact.getExpectedScope().getRiskLevel();

        if (confidence < 0.4) {
            risk = risk.bump();
        } else if (confidence > 0.8) {
            risk = risk.relax();
        }

        if (impact.requiredCascadeCount() > 2) {
            risk = risk.bump();
        }
        return risk;
    }

    // =========================================================================
    // Threshold helpers
    // =========================================================================

    public double thresholdFor(ChangeApproach approach) {
        return approach.getThreshold();
    }

    public boolean meetsThreshold(double confidence, ChangeApproach approach) {
        return confidence >= thresholdFor(approach);
    }

    public ChangeApproach approachFor(double confidence) {
        return ChangeApproach.forConfidence(confidence);
    }

    public ValidationLevel recommendedValidationLevel(ChangeConfidenceAssessment assessment) {
        return ValidationLevel.forAssessment(assessment);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
