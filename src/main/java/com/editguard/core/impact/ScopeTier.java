package com.editguard.core.impact;

/**
 * ScopeTier: coarse size class of a predicted change.
 *
 * The multiplier scales the expected response size the prompt builder reports;
 * the simplicity penalty is what the confidence engine subtracts for the tier.
 */
public enum ScopeTier {
    MINIMAL     (1, 0.0),
    MODERATE    (2, 0.1),
    SIGNIFICANT (3, 0.3),
    MAJOR       (4, 0.5);

    private final int    responseMultiplier;
    private final double simplicityPenalty;

    ScopeTier(int responseMultiplier, double simplicityPenalty) {
        this.responseMultiplier = responseMultiplier;
        this.simplicityPenalty  = simplicityPenalty;
    }

    public int    getResponseMultiplier() { return responseMultiplier; }
    public double getSimplicityPenalty()  { return simplicityPenalty; }

    /** Tier for a predicted line count: ≤3 minimal, ≤10 moderate, ≤25 significant. */
    public static ScopeTier forExpectedLines(int lines) {
        if (lines <= 3)  return MINIMAL;
        if (lines <= 10) return MODERATE;
        if (lines <= 25) return SIGNIFICANT;
        return MAJOR;
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
