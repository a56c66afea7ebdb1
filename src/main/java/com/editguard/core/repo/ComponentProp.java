package com.editguard.core.repo;

public class ComponentProp {

    private final String  name;
    private final String  type;
    private final boolean required;

    public ComponentProp(String name, String type, boolean required) {
        this.name     = name;
        this.type     = type != null ? type : "unknown";
        this.required = required;
    }

    public String  getName()    { return name; }
    public String  getType()    { return type; }
    public boolean isRequired() { return required; }

    @Override
    public String toString() {
        return name + ": " + type + (required ? " (required)" : "");
    }
}
