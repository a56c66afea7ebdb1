package com.editguard.core.request;

/**
 * TargetElement: the DOM element the edit was captured on.
 *
 * selector may be empty when the capture surface could not resolve one.
 * className is optional and never null (empty string when absent).
 */
public class TargetElement {

    private final String tagName;
    private final String selector;
    private final String className;

    public TargetElement(String tagName, String selector, String className) {
        this.tagName   = tagName   != null ? tagName   : "";
        this.selector  = selector  != null ? selector  : "";
        this.className = className != null ? className : "";
    }

    public static TargetElement of(String tagName, String selector) {
        return new TargetElement(tagName, selector, null);
    }

    public String getTagName()   { return tagName; }
    public String getSelector()  { return selector; }
    public String getClassName() { return className; }

    public boolean hasSelector() {
        return !selector.isBlank();
    }

    /** Class or id selectors pin the element more precisely than a bare tag. */
    public boolean isSpecificSelector() {
        return selector.contains(".") || selector.contains("#");
    }

    @Override
    public String toString() {
        return String.format("%s (selector: %s)",
                tagName.isEmpty() ? "unknown" : tagName,
                selector.isEmpty() ? "unknown" : selector);
    }
}
