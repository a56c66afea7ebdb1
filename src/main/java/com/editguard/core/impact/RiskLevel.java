package com.editguard.core.impact;

/**
 * RiskLevel: ordered risk tiers. Ordinal order is significant: later is riskier.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * One step riskier, but only out of LOW or MEDIUM.
     * HIGH and CRITICAL are left alone so repeated bumps never compound past HIGH.
     */
    public RiskLevel bump() {
        return switch (this) {
            case LOW    -> MEDIUM;
            case MEDIUM -> HIGH;
            default     -> this;
        };
    }

    /** One step safer, only out of HIGH or MEDIUM. CRITICAL is never relaxed. */
    public RiskLevel relax() {
        return switch (this) {
            case HIGH   -> MEDIUM;
            case MEDIUM -> LOW;
            default     -> this;
        };
    }

    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }

    /** Penalty the confidence engine applies to simplicity: 0 / 0.1 / 0.2 (critical counts as high). */
    public double simplicityPenalty() {
        return switch (this) {
            case LOW    -> 0.0;
            case MEDIUM -> 0.1;
            default     -> 0.2;
        };
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
