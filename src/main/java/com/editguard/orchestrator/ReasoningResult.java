package com.editguard.orchestrator;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.execution.GeneratedChange;
import com.editguard.core.validation.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one pipeline run.
 *
 * Two shapes:
 *   completed → execution ran; success mirrors the final validation verdict
 *   failed    → a fatal stage error; no changes, error message set
 *
 * assessment, validation and strategyUsed are absent when the pipeline failed
 * before producing them.
 */
public final class ReasoningResult {

    private final String                     requestId;
    private final boolean                    success;
    private final List<GeneratedChange>      fileChanges;
    private final ChangeConfidenceAssessment assessment;
    private final ValidationResult           validation;
    private final ChangeApproach             strategyUsed;
    private final List<String>               executionLog;
    private final String                     summary;
    private final String                     error;
    private final boolean                    requiresHumanReview;

    private ReasoningResult(String                     requestId,
                            boolean                    success,
                            List<GeneratedChange>      fileChanges,
                            ChangeConfidenceAssessment assessment,
                            ValidationResult           validation,
                            ChangeApproach             strategyUsed,
                            List<String>               executionLog,
                            String                     summary,
                            String                     error,
                            boolean                    requiresHumanReview) {
        this.requestId           = requestId;
        this.success             = success;
        this.fileChanges         = fileChanges  != null ? List.copyOf(fileChanges)  : List.of();
        this.assessment          = assessment;
        this.validation          = validation;
        this.strategyUsed        = strategyUsed;
        this.executionLog        = executionLog != null ? List.copyOf(executionLog) : List.of();
        this.summary             = summary != null ? summary : "";
        this.error               = error;
        this.requiresHumanReview = requiresHumanReview;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static ReasoningResult completed(String                     requestId,
                                            List<GeneratedChange>      fileChanges,
                                            ChangeConfidenceAssessment assessment,
                                            ValidationResult           validation,
                                            ChangeApproach             strategyUsed,
                                            List<String>               executionLog,
                                            String                     summary) {
        String error = validation.isPassed()
                ? null
                : validation.firstError().map(i -> i.getMessage()).orElse("Validation failed");
        return new ReasoningResult(requestId, validation.isPassed(), fileChanges, assessment, validation,
                strategyUsed, executionLog, summary, error, strategyUsed.isHumanReview());
    }

    public static ReasoningResult failed(String                     requestId,
                                         ChangeConfidenceAssessment assessment,
                                         String                     error,
                                         String                     summary) {
        return new ReasoningResult(requestId, false, List.of(), assessment, null, null,
                List.of(), summary, error, true);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String                               getRequestId()    { return requestId; }
    public boolean                              isSuccess()       { return success; }
    public List<GeneratedChange>                getFileChanges()  { return fileChanges; }
    public Optional<ChangeConfidenceAssessment> getAssessment()   { return Optional.ofNullable(assessment); }
    public Optional<ValidationResult>           getValidation()   { return Optional.ofNullable(validation); }
    public Optional<ChangeApproach>             getStrategyUsed() { return Optional.ofNullable(strategyUsed); }
    public List<String>                         getExecutionLog() { return executionLog; }
    public String                               getSummary()      { return summary; }
    public Optional<String>                     getError()        { return Optional.ofNullable(error); }

    /** True for proposals and for fatal failures: either way a person has to look. */
    public boolean requiresHumanReview() {
        return requiresHumanReview;
    }

    @Override
    public String toString() {
        return String.format("ReasoningResult{request=%s, success=%s, strategy=%s, changes=%d%s}",
                requestId, success,
                strategyUsed != null ? strategyUsed.getId() : "none",
                fileChanges.size(),
                error != null ? ", error=" + error : "");
    }
}
