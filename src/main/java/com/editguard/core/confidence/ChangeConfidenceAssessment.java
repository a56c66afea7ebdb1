package com.editguard.core.confidence;

import com.editguard.core.impact.RiskLevel;

import java.util.List;
import java.util.Objects;

/**
 * ChangeConfidenceAssessment: immutable output of {@link ConfidenceEngine#assess}.
 *
 * Computed once per run and reused across retries: on failure the strategy
 * escalates, the assessment does not change.
 */
public final class ChangeConfidenceAssessment {

    private final ConfidenceFactors    factors;
    private final double               confidence;
    private final ChangeApproach       recommendedApproach;
    private final List<ChangeApproach> fallbackApproaches;
    private final RiskLevel            riskLevel;

    public ChangeConfidenceAssessment(ConfidenceFactors    factors,
                                      double               confidence,
                                      ChangeApproach       recommendedApproach,
                                      List<ChangeApproach> fallbackApproaches,
                                      RiskLevel            riskLevel) {
        this.factors             = Objects.requireNonNull(factors, "factors");
        this.confidence          = confidence;
        this.recommendedApproach = Objects.requireNonNull(recommendedApproach, "recommendedApproach");
        this.fallbackApproaches  = fallbackApproaches != null ? List.copyOf(fallbackApproaches) : List.of();
        this.riskLevel           = Objects.requireNonNull(riskLevel, "riskLevel");
    }

    public ConfidenceFactors    getFactors()             { return factors; }
    public double               getConfidence()          { return confidence; }
    public ChangeApproach       getRecommendedApproach() { return recommendedApproach; }
    public List<ChangeApproach> getFallbackApproaches()  { return fallbackApproaches; }
    public RiskLevel            getRiskLevel()           { return riskLevel; }

    public boolean requiresHumanReview() {
        return recommendedApproach.isHumanReview();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeConfidenceAssessment)) return false;
        ChangeConfidenceAssessment a = (ChangeConfidenceAssessment) o;
        return Double.compare(confidence, a.confidence) == 0
                && factors.equals(a.factors)
                && recommendedApproach == a.recommendedApproach
                && fallbackApproaches.equals(a.fallbackApproaches)
                && riskLevel == a.riskLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(factors, confidence, recommendedApproach, fallbackApproaches, riskLevel);
    }

    @Override
    public String toString() {
        return String.format("ChangeConfidenceAssessment{confidence=%.2f, approach=%s, fallbacks=%s, risk=%s}",
                confidence, recommendedApproach, fallbackApproaches, riskLevel);
    }
}
