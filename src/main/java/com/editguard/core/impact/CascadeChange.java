package com.editguard.core.impact;

/**
 * A related change implied by a direct change. Required cascades count against
 * confidence and raise the risk tier.
 */
public class CascadeChange {

    public enum Type { PARENT_CONTAINER, SIBLING_ELEMENT, CHILD_ELEMENT, DESIGN_SYSTEM }

    private final Type    type;
    private final String  target;
    private final String  reason;
    private final boolean required;
    private final double  confidence;

    public CascadeChange(Type type, String target, String reason, boolean required, double confidence) {
        this.type       = type;
        this.target     = target != null ? target : "";
        this.reason     = reason != null ? reason : "";
        this.required   = required;
        this.confidence = confidence;
    }

    public Type    getType()       { return type; }
    public String  getTarget()     { return target; }
    public String  getReason()     { return reason; }
    public boolean isRequired()    { return required; }
    public double  getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("%s %s (%s)%s", type, target, reason, required ? " [required]" : "");
    }
}
