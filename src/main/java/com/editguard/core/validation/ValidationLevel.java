package com.editguard.core.validation;

import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.impact.RiskLevel;
import com.editguard.core.request.ChangeCategory;

/**
 * ValidationLevel: strictness of the scope guard.
 *
 * Each level scales the per-category deletion and change-ratio ceilings.
 * BASIC is never derived from an assessment; it exists for callers that
 * validate hand-written edits.
 */
public enum ValidationLevel {

    BASIC    (2.0, 2.0),
    STANDARD (1.5, 1.5),
    STRICT   (1.0, 1.0),
    PARANOID (0.5, 0.7);

    private final double deletionMultiplier;
    private final double ratioMultiplier;

    ValidationLevel(double deletionMultiplier, double ratioMultiplier) {
        this.deletionMultiplier = deletionMultiplier;
        this.ratioMultiplier    = ratioMultiplier;
    }

    public double getDeletionMultiplier() { return deletionMultiplier; }
    public double getRatioMultiplier()    { return ratioMultiplier; }

    /** Lines that may be removed: floor(base × multiplier), base 3/8/15/10 for styling/layout/structure/other. */
    public int deletionCeiling(ChangeCategory category) {
        int base = switch (category) {
            case STYLING   -> 3;
            case LAYOUT    -> 8;
            case STRUCTURE -> 15;
            default        -> 10;
        };
        return (int) Math.floor(base * deletionMultiplier);
    }

    /** Share of the file that may change: base 0.1/0.2/0.4/0.3 × multiplier. */
    public double changeRatioCeiling(ChangeCategory category) {
        double base = switch (category) {
            case STYLING   -> 0.1;
            case LAYOUT    -> 0.2;
            case STRUCTURE -> 0.4;
            default        -> 0.3;
        };
        return base * ratioMultiplier;
    }

    /** ≥0.8 confidence with low risk → STANDARD; ≥0.6 → STRICT; anything lower → PARANOID. */
    public static ValidationLevel forAssessment(ChangeConfidenceAssessment assessment) {
        double confidence = assessment.getConfidence();
        if (confidence >= 0.8 && assessment.getRiskLevel() == RiskLevel.LOW) {
            return STANDARD;
        }
        if (confidence >= 0.6) {
            return STRICT;
        }
        return PARANOID;
    }
}
