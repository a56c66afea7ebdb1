package com.editguard.core.repo;

import java.util.List;

/**
 * TargetComponent: the component the change lands in, as described by the
 * symbolic repository model. Read-only to the pipeline.
 *
 * Construct via {@link #builder(String, String)}; unspecified collections are empty,
 * never null.
 */
public final class TargetComponent {

    private final String              name;
    private final String              filePath;
    private final String              framework;
    private final ComplexityTier      complexity;
    private final List<ComponentProp> props;
    private final List<String>        exports;
    private final List<String>        imports;
    private final StylingApproach     stylingApproach;
    private final List<String>        cssClasses;
    private final boolean             inlineStyles;
    private final String              content;

    private TargetComponent(Builder b) {
        this.name            = b.name;
        this.filePath        = b.filePath;
        this.framework       = b.framework;
        this.complexity      = b.complexity;
        this.props           = List.copyOf(b.props);
        this.exports         = List.copyOf(b.exports);
        this.imports         = List.copyOf(b.imports);
        this.stylingApproach = b.stylingApproach;
        this.cssClasses      = List.copyOf(b.cssClasses);
        this.inlineStyles    = b.inlineStyles;
        this.content         = b.content;
    }

    public String              getName()            { return name; }
    public String              getFilePath()        { return filePath; }
    public String              getFramework()       { return framework; }
    public ComplexityTier      getComplexity()      { return complexity; }
    public List<ComponentProp> getProps()           { return props; }
    public List<String>        getExports()         { return exports; }
    public List<String>        getImports()         { return imports; }
    public StylingApproach     getStylingApproach() { return stylingApproach; }
    public List<String>        getCssClasses()      { return cssClasses; }
    public boolean             hasInlineStyles()    { return inlineStyles; }
    public String              getContent()         { return content; }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    public static Builder builder(String name, String filePath) {
        return new Builder(name, filePath);
    }

    @Override
    public String toString() {
        return String.format("TargetComponent{name=%s, file=%s, complexity=%s, styling=%s}",
                name, filePath, complexity, stylingApproach.displayName());
    }

    public static final class Builder {
        private final String        name;
        private final String        filePath;
        private String              framework       = "react";
        private ComplexityTier      complexity      = ComplexityTier.MODERATE;
        private List<ComponentProp> props           = List.of();
        private List<String>        exports         = List.of();
        private List<String>        imports         = List.of();
        private StylingApproach     stylingApproach = StylingApproach.UNKNOWN;
        private List<String>        cssClasses      = List.of();
        private boolean             inlineStyles    = false;
        private String              content         = "";

        private Builder(String name, String filePath) {
            this.name     = name != null ? name : "Unknown";
            this.filePath = filePath != null ? filePath : "";
        }

        public Builder framework(String v)               { this.framework = v != null ? v : "react"; return this; }
        public Builder complexity(ComplexityTier v)      { this.complexity = v != null ? v : ComplexityTier.MODERATE; return this; }
        public Builder props(List<ComponentProp> v)      { this.props = v != null ? v : List.of(); return this; }
        public Builder exports(List<String> v)           { this.exports = v != null ? v : List.of(); return this; }
        public Builder imports(List<String> v)           { this.imports = v != null ? v : List.of(); return this; }
        public Builder stylingApproach(StylingApproach v){ this.stylingApproach = v != null ? v : StylingApproach.UNKNOWN; return this; }
        public Builder cssClasses(List<String> v)        { this.cssClasses = v != null ? v : List.of(); return this; }
        public Builder inlineStyles(boolean v)           { this.inlineStyles = v; return this; }
        public Builder content(String v)                 { this.content = v != null ? v : ""; return this; }

        public TargetComponent build() {
            return new TargetComponent(this);
        }
    }
}
