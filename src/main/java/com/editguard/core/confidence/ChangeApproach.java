package com.editguard.core.confidence;

import java.util.List;

/**
 * ChangeApproach: the four execution strategies, least to most conservative.
 *
 * Each approach owns one confidence band [threshold, upper). The bands are
 * contiguous and cover [0, 1]; the top band includes 1.0. Ordinal order is the
 * conservatism order: fallbacks only ever move to a later constant.
 */
public enum ChangeApproach {

    HIGH_CONFIDENCE_DIRECT          ("high-confidence-direct",           0.8, 1.0),
    MEDIUM_CONFIDENCE_GUIDED        ("medium-confidence-guided",         0.6, 0.8),
    LOW_CONFIDENCE_CONSERVATIVE     ("low-confidence-conservative",      0.4, 0.6),
    VERY_LOW_CONFIDENCE_HUMAN_REVIEW("very-low-confidence-human-review", 0.0, 0.4);

    private final String id;
    private final double threshold;
    private final double upperBound;

    ChangeApproach(String id, double threshold, double upperBound) {
        this.id         = id;
        this.threshold  = threshold;
        this.upperBound = upperBound;
    }

    public String getId()         { return id; }
    public double getThreshold()  { return threshold; }
    public double getUpperBound() { return upperBound; }

    /** Whether {@code confidence} falls in this approach's band. */
    public boolean bandContains(double confidence) {
        if (this == HIGH_CONFIDENCE_DIRECT) {
            return confidence >= threshold && confidence <= upperBound;
        }
        return confidence >= threshold && confidence < upperBound;
    }

    public boolean isMoreConservativeThan(ChangeApproach other) {
        return ordinal() > other.ordinal();
    }

    public boolean isHumanReview() {
        return this == VERY_LOW_CONFIDENCE_HUMAN_REVIEW;
    }

    /** Standard fallback chain. Human review is terminal. */
    public List<ChangeApproach> standardFallbacks() {
        return switch (this) {
            case HIGH_CONFIDENCE_DIRECT      -> List.of(MEDIUM_CONFIDENCE_GUIDED, LOW_CONFIDENCE_CONSERVATIVE);
            case MEDIUM_CONFIDENCE_GUIDED    -> List.of(LOW_CONFIDENCE_CONSERVATIVE, VERY_LOW_CONFIDENCE_HUMAN_REVIEW);
            case LOW_CONFIDENCE_CONSERVATIVE -> List.of(VERY_LOW_CONFIDENCE_HUMAN_REVIEW);
            case VERY_LOW_CONFIDENCE_HUMAN_REVIEW -> List.of();
        };
    }

    /** The approach whose band contains {@code confidence}; values outside [0,1] are clamped. */
    public static ChangeApproach forConfidence(double confidence) {
        double c = Math.max(0.0, Math.min(1.0, confidence));
        for (ChangeApproach approach : values()) {
            if (approach.bandContains(c)) {
                return approach;
            }
        }
        return VERY_LOW_CONFIDENCE_HUMAN_REVIEW;
    }

    @Override
    public String toString() {
        return id;
    }
}
