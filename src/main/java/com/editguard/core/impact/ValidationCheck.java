package com.editguard.core.impact;

/** Descriptor of a check the generated output will be held to. Rendered into guided prompts. */
public class ValidationCheck {

    public enum Type { SYNTAX, TYPE_CHECK, BUILD, VISUAL_REGRESSION, INTENT_ALIGNMENT, PRESERVATION, SCOPE }

    private final Type    type;
    private final String  description;
    private final boolean required;

    public ValidationCheck(Type type, String description, boolean required) {
        this.type        = type;
        this.description = description != null ? description : "";
        this.required    = required;
    }

    public Type    getType()        { return type; }
    public String  getDescription() { return description; }
    public boolean isRequired()     { return required; }

    @Override
    public String toString() {
        return type + ": " + description + (required ? " (required)" : "");
    }
}
