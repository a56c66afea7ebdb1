package com.editguard.core.impact;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ChangeImpactAnalysis: what a change is expected to touch and what it must not break.
 *
 * Computed once per request (by an {@link ImpactAnalyzer} or supplied by the caller)
 * and never mutated afterwards. All lists are immutable copies.
 */
public final class ChangeImpactAnalysis {

    private final ExpectedScope          expectedScope;
    private final List<DirectChange>     directChanges;
    private final List<CascadeChange>    cascadeChanges;
    private final List<PreservationRule> preservationRules;
    private final List<ValidationCheck>  validationChecks;

    public ChangeImpactAnalysis(ExpectedScope          expectedScope,
                                List<DirectChange>     directChanges,
                                List<CascadeChange>    cascadeChanges,
                                List<PreservationRule> preservationRules,
                                List<ValidationCheck>  validationChecks) {
        this.expectedScope     = expectedScope != null
                ? expectedScope
                : new ExpectedScope(0, 1, ScopeTier.MINIMAL, RiskLevel.LOW);
        this.directChanges     = directChanges     != null ? List.copyOf(directChanges)     : List.of();
        this.cascadeChanges    = cascadeChanges    != null ? List.copyOf(cascadeChanges)    : List.of();
        this.preservationRules = preservationRules != null ? List.copyOf(preservationRules) : List.of();
        this.validationChecks  = validationChecks  != null ? List.copyOf(validationChecks)  : List.of();
    }

    public ExpectedScope          getExpectedScope()     { return expectedScope; }
    public List<DirectChange>     getDirectChanges()     { return directChanges; }
    public List<CascadeChange>    getCascadeChanges()    { return cascadeChanges; }
    public List<PreservationRule> getPreservationRules() { return preservationRules; }
    public List<ValidationCheck>  getValidationChecks()  { return validationChecks; }

    public long requiredCascadeCount() {
        return cascadeChanges.stream().filter(CascadeChange::isRequired).count();
    }

    public boolean hasRequiredCascade() {
        return requiredCascadeCount() > 0;
    }

    public List<PreservationRule> criticalRules() {
        return preservationRules.stream().filter(PreservationRule::isCritical).collect(Collectors.toList());
    }

    public List<PreservationRule> importantRules() {
        return preservationRules.stream().filter(r -> !r.isCritical()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("ChangeImpactAnalysis{scope=%s, direct=%d, cascade=%d, rules=%d}",
                expectedScope, directChanges.size(), cascadeChanges.size(), preservationRules.size());
    }
}
