package com.editguard.core.prompt;

/**
 * Plain-language labels for confidence factor scores.
 * Bands: Excellent above 0.8, Good above 0.6, Fair above 0.4, otherwise Poor.
 */
public final class FactorDescriptions {

    private FactorDescriptions() {}

    public static String level(double value) {
        if (value > 0.8) return "Excellent";
        if (value > 0.6) return "Good";
        if (value > 0.4) return "Fair";
        return "Poor";
    }

    public static String visual(double value) {
        return switch (level(value)) {
            case "Excellent" -> "Clear visual intent with specific changes";
            case "Good"      -> "Well-defined visual changes";
            case "Fair"      -> "Somewhat clear visual intent";
            default          -> "Unclear or vague visual changes";
        };
    }

    public static String component(double value) {
        return switch (level(value)) {
            case "Excellent" -> "Component fully analyzed and understood";
            case "Good"      -> "Component well understood";
            case "Fair"      -> "Component partially understood";
            default          -> "Component poorly understood";
        };
    }

    public static String complexity(double value) {
        return switch (level(value)) {
            case "Excellent" -> "Very simple change";
            case "Good"      -> "Simple change";
            case "Fair"      -> "Moderate complexity";
            default          -> "High complexity change";
        };
    }

    public static String context(double value) {
        return switch (level(value)) {
            case "Excellent" -> "Complete repository context available";
            case "Good"      -> "Good repository context";
            case "Fair"      -> "Partial repository context";
            default          -> "Limited repository context";
        };
    }
}
