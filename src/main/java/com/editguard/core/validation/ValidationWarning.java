package com.editguard.core.validation;

/** Softer finding. Never affects {@link ValidationResult#isPassed()}. */
public class ValidationWarning {

    public enum Type { INTENT_ALIGNMENT, PRESERVATION, SCOPE, COMPLEXITY }

    private final Type   type;
    private final String message;
    private final String suggestion;

    public ValidationWarning(Type type, String message, String suggestion) {
        this.type       = type;
        this.message    = message    != null ? message    : "";
        this.suggestion = suggestion != null ? suggestion : "";
    }

    public Type   getType()       { return type; }
    public String getMessage()    { return message; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return String.format("[WARN/%s] %s", type, message);
    }
}
