package com.editguard.core.impact;

/**
 * A change the request asks for explicitly: one target, one property, one new value.
 */
public class DirectChange {

    public enum Type { CSS_PROPERTY, CLASS_NAME, INLINE_STYLE, COMPONENT_PROP }

    private final Type   type;
    private final String target;
    private final String property;
    private final String oldValue;
    private final String newValue;
    private final double confidence;

    public DirectChange(Type type, String target, String property,
                        String oldValue, String newValue, double confidence) {
        this.type       = type;
        this.target     = target   != null ? target   : "";
        this.property   = property != null ? property : "";
        this.oldValue   = oldValue != null ? oldValue : "";
        this.newValue   = newValue != null ? newValue : "";
        this.confidence = confidence;
    }

    public Type   getType()       { return type; }
    public String getTarget()     { return target; }
    public String getProperty()   { return property; }
    public String getOldValue()   { return oldValue; }
    public String getNewValue()   { return newValue; }
    public double getConfidence() { return confidence; }

    @Override
    public String toString() {
        return String.format("%s %s.%s: %s → %s", type, target, property, oldValue, newValue);
    }
}
