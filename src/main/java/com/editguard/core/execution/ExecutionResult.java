package com.editguard.core.execution;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.validation.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one adaptive execution.
 *
 * validation is always the latest attempt's result. fileChanges is empty when
 * the last attempt produced no output. strategyUsed is the strategy of the
 * last attempt, which is never less conservative than the recommended one.
 */
public final class ExecutionResult {

    private final List<GeneratedChange> fileChanges;
    private final ChangeApproach        strategyUsed;
    private final ValidationResult      validation;
    private final List<String>          executionLog;
    private final List<AttemptRecord>   attempts;

    public ExecutionResult(List<GeneratedChange> fileChanges,
                           ChangeApproach        strategyUsed,
                           ValidationResult      validation,
                           List<String>          executionLog,
                           List<AttemptRecord>   attempts) {
        this.fileChanges  = fileChanges  != null ? List.copyOf(fileChanges)  : List.of();
        this.strategyUsed = Objects.requireNonNull(strategyUsed, "strategyUsed");
        this.validation   = Objects.requireNonNull(validation, "validation");
        this.executionLog = executionLog != null ? List.copyOf(executionLog) : List.of();
        this.attempts     = attempts     != null ? List.copyOf(attempts)     : List.of();
    }

    public List<GeneratedChange> getFileChanges()  { return fileChanges; }
    public ChangeApproach        getStrategyUsed() { return strategyUsed; }
    public ValidationResult      getValidation()   { return validation; }
    public List<String>          getExecutionLog() { return executionLog; }
    public List<AttemptRecord>   getAttempts()     { return attempts; }

    public boolean isPassed() {
        return validation.isPassed();
    }

    /** True when the output is a proposal for a human rather than an applied edit. */
    public boolean isProposal() {
        return strategyUsed.isHumanReview() && !fileChanges.isEmpty();
    }

    public int attemptCount() {
        return attempts.size();
    }

    @Override
    public String toString() {
        return String.format("ExecutionResult{strategy=%s, passed=%s, attempts=%d, changes=%d}",
                strategyUsed.getId(), validation.isPassed(), attempts.size(), fileChanges.size());
    }
}
