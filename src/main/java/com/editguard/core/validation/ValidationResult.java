package com.editguard.core.validation;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ValidationResult: verdict for one proposed change.
 *
 * passed is derived, never supplied: true iff no issue has severity ERROR.
 * Produced fresh per attempt; the latest attempt's result is authoritative.
 */
public final class ValidationResult {

    private final boolean                 passed;
    private final double                  confidence;
    private final List<ValidationIssue>   issues;
    private final List<ValidationWarning> warnings;
    private final ValidationMetrics       metrics;
    private final ValidationLevel         level;

    public ValidationResult(double                  confidence,
                            List<ValidationIssue>   issues,
                            List<ValidationWarning> warnings,
                            ValidationMetrics       metrics,
                            ValidationLevel         level) {
        this.issues     = issues   != null ? List.copyOf(issues)   : List.of();
        this.warnings   = warnings != null ? List.copyOf(warnings) : List.of();
        this.passed     = this.issues.stream().noneMatch(ValidationIssue::isError);
        this.confidence = confidence;
        this.metrics    = metrics;
        this.level      = level;
    }

    /** Failed result for an attempt whose backend call returned no content. */
    public static ValidationResult notGenerated(String reason, double confidence, ValidationLevel level) {
        return new ValidationResult(
                Math.max(0.1, confidence - 0.2),
                List.of(ValidationIssue.error(IssueType.GENERATION_FAILED, reason,
                        "Retry later or check the generation backend")),
                List.of(),
                new ValidationMetrics(0, 0, 0, 0.0, 0),
                level);
    }

    public boolean                 isPassed()      { return passed; }
    public double                  getConfidence() { return confidence; }
    public List<ValidationIssue>   getIssues()     { return issues; }
    public List<ValidationWarning> getWarnings()   { return warnings; }
    public ValidationMetrics       getMetrics()    { return metrics; }
    public ValidationLevel         getLevel()      { return level; }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).collect(Collectors.toList());
    }

    public boolean hasIssue(IssueType type) {
        return issues.stream().anyMatch(i -> i.getType() == type);
    }

    public boolean hasError(IssueType type) {
        return issues.stream().anyMatch(i -> i.isError() && i.getType() == type);
    }

    public Optional<ValidationIssue> firstError() {
        return issues.stream().filter(ValidationIssue::isError).findFirst();
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{passed=%s, confidence=%.2f, errors=%d, warnings=%d, level=%s}",
                passed, confidence, errors().size(), warnings.size(), level);
    }
}
