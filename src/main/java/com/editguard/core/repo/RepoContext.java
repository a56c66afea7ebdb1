package com.editguard.core.repo;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RepoContext: the symbolic repository model produced by repository analysis.
 *
 * Consumed as read-only context by every stage of the pipeline. Only the
 * attributes that feed confidence scoring and prompt context are modelled;
 * per-file hashes and analysis timestamps stay with the producer.
 *
 * Construct via {@link #builder(String)}.
 */
public final class RepoContext {

    private final String                    repoId;
    private final String                    primaryFramework;
    private final String                    frameworkVersion;
    private final StylingApproach           stylingApproach;
    private final List<TargetComponent>     components;
    private final DesignTokens              designTokens;     // nullable
    private final StylingPatterns           stylingPatterns;  // nullable
    private final Map<String, String>       cssVariables;
    private final Map<String, List<String>> domMappings;      // selector → component names
    private final List<String>              transformationRules;
    private final String                    namingConvention;
    private final double                    analysisConfidence;

    private RepoContext(Builder b) {
        this.repoId              = b.repoId;
        this.primaryFramework    = b.primaryFramework;
        this.frameworkVersion    = b.frameworkVersion;
        this.stylingApproach     = b.stylingApproach;
        this.components          = List.copyOf(b.components);
        this.designTokens        = b.designTokens;
        this.stylingPatterns     = b.stylingPatterns;
        this.cssVariables        = Map.copyOf(b.cssVariables);
        this.domMappings         = Map.copyOf(b.domMappings);
        this.transformationRules = List.copyOf(b.transformationRules);
        this.namingConvention    = b.namingConvention;
        this.analysisConfidence  = Math.max(0.0, Math.min(1.0, b.analysisConfidence));
    }

    public String                    getRepoId()              { return repoId; }
    public String                    getPrimaryFramework()    { return primaryFramework; }
    public String                    getFrameworkVersion()    { return frameworkVersion; }
    public StylingApproach           getStylingApproach()     { return stylingApproach; }
    public List<TargetComponent>     getComponents()          { return components; }
    public Optional<DesignTokens>    getDesignTokens()        { return Optional.ofNullable(designTokens); }
    public Optional<StylingPatterns> getStylingPatterns()     { return Optional.ofNullable(stylingPatterns); }
    public Map<String, String>       getCssVariables()        { return cssVariables; }
    public Map<String, List<String>> getDomMappings()         { return domMappings; }
    public List<String>              getTransformationRules() { return transformationRules; }
    public String                    getNamingConvention()    { return namingConvention; }
    public double                    getAnalysisConfidence()  { return analysisConfidence; }

    public int componentCount() {
        return components.size();
    }

    public boolean hasDesignTokens() {
        return designTokens != null;
    }

    public boolean hasStylingPatterns() {
        return stylingPatterns != null && !stylingPatterns.isEmpty();
    }

    /** An empty model: no components, no tokens, no mappings. */
    public static RepoContext empty(String repoId) {
        return builder(repoId).build();
    }

    public static Builder builder(String repoId) {
        return new Builder(repoId);
    }

    public static final class Builder {
        private final String              repoId;
        private String                    primaryFramework    = "react";
        private String                    frameworkVersion    = "";
        private StylingApproach           stylingApproach     = StylingApproach.UNKNOWN;
        private List<TargetComponent>     components          = List.of();
        private DesignTokens              designTokens;
        private StylingPatterns           stylingPatterns;
        private Map<String, String>       cssVariables        = Map.of();
        private Map<String, List<String>> domMappings         = Map.of();
        private List<String>              transformationRules = List.of();
        private String                    namingConvention    = "PascalCase";
        private double                    analysisConfidence  = 0.5;

        private Builder(String repoId) {
            this.repoId = repoId != null ? repoId : "unknown";
        }

        public Builder primaryFramework(String v)                 { this.primaryFramework = v != null ? v : "react"; return this; }
        public Builder frameworkVersion(String v)                 { this.frameworkVersion = v != null ? v : ""; return this; }
        public Builder stylingApproach(StylingApproach v)         { this.stylingApproach = v != null ? v : StylingApproach.UNKNOWN; return this; }
        public Builder components(List<TargetComponent> v)        { this.components = v != null ? v : List.of(); return this; }
        public Builder designTokens(DesignTokens v)               { this.designTokens = v; return this; }
        public Builder stylingPatterns(StylingPatterns v)         { this.stylingPatterns = v; return this; }
        public Builder cssVariables(Map<String, String> v)        { this.cssVariables = v != null ? v : Map.of(); return this; }
        public Builder domMappings(Map<String, List<String>> v)   { this.domMappings = v != null ? v : Map.of(); return this; }
        public Builder transformationRules(List<String> v)        { this.transformationRules = v != null ? v : List.of(); return this; }
        public Builder namingConvention(String v)                 { this.namingConvention = v != null ? v : "PascalCase"; return this; }
        public Builder analysisConfidence(double v)               { this.analysisConfidence = v; return this; }

        public RepoContext build() {
            return new RepoContext(this);
        }
    }
}
