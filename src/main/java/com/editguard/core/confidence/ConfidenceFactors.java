package com.editguard.core.confidence;

import java.util.Objects;

/**
 * The four independent factor scores, each already clamped to [0,1].
 * changeComplexity is scored as simplicity: higher means an easier change.
 */
public final class ConfidenceFactors {

    public static final double VISUAL_CLARITY_WEIGHT          = 0.30;
    public static final double COMPONENT_UNDERSTANDING_WEIGHT = 0.30;
    public static final double CHANGE_COMPLEXITY_WEIGHT       = 0.25;
    public static final double CONTEXT_COMPLETENESS_WEIGHT    = 0.15;

    private final double visualClarity;
    private final double componentUnderstanding;
    private final double changeComplexity;
    private final double contextCompleteness;

    public ConfidenceFactors(double visualClarity,
                             double componentUnderstanding,
                             double changeComplexity,
                             double contextCompleteness) {
        this.visualClarity          = clamp(visualClarity);
        this.componentUnderstanding = clamp(componentUnderstanding);
        this.changeComplexity       = clamp(changeComplexity);
        this.contextCompleteness    = clamp(contextCompleteness);
    }

    public double getVisualClarity()          { return visualClarity; }
    public double getComponentUnderstanding() { return componentUnderstanding; }
    public double getChangeComplexity()       { return changeComplexity; }
    public double getContextCompleteness()    { return contextCompleteness; }

    public double weightedSum() {
        return visualClarity          * VISUAL_CLARITY_WEIGHT
             + componentUnderstanding * COMPONENT_UNDERSTANDING_WEIGHT
             + changeComplexity       * CHANGE_COMPLEXITY_WEIGHT
             + contextCompleteness    * CONTEXT_COMPLETENESS_WEIGHT;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfidenceFactors)) return false;
        ConfidenceFactors f = (ConfidenceFactors) o;
        return Double.compare(visualClarity, f.visualClarity) == 0
                && Double.compare(componentUnderstanding, f.componentUnderstanding) == 0
                && Double.compare(changeComplexity, f.changeComplexity) == 0
                && Double.compare(contextCompleteness, f.contextCompleteness) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(visualClarity, componentUnderstanding, changeComplexity, contextCompleteness);
    }

    @Override
    public String toString() {
        return String.format("ConfidenceFactors{visual=%.2f, component=%.2f, simplicity=%.2f, context=%.2f}",
                visualClarity, componentUnderstanding, changeComplexity, contextCompleteness);
    }
}
