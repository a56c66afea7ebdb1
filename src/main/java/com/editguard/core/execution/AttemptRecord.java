package com.editguard.core.execution;

import com.editguard.core.confidence.ChangeApproach;

/**
 * Immutable record of one generation attempt (prompt → generate → validate).
 *
 * Rate-limit waits inside an attempt are counted here, not as extra attempts.
 * Collected in order on the ExecutionResult and rendered into the execution
 * log and the correction prompt of the next attempt.
 */
public final class AttemptRecord {

    public enum Outcome {
        /** Output produced and validation passed. */
        PASSED,
        /** Output produced but validation reported at least one error. */
        VALIDATION_FAILED,
        /** Backend returned no usable output (transient, permanent or rate-limit exhaustion). */
        GENERATION_FAILED,
        /** Caller cancelled or the waiting thread was interrupted. */
        CANCELLED
    }

    private final int            attemptNumber;
    private final ChangeApproach approach;
    private final Outcome        outcome;

    /** First validation error or backend error message; null when PASSED. */
    private final String error;

    private final int     rateLimitWaits;
    private final boolean correctionIssued;
    private final int     errorCount;
    private final int     warningCount;

    private AttemptRecord(Builder b) {
        this.attemptNumber    = b.attemptNumber;
        this.approach         = b.approach;
        this.outcome          = b.outcome;
        this.error            = b.error;
        this.rateLimitWaits   = b.rateLimitWaits;
        this.correctionIssued = b.correctionIssued;
        this.errorCount       = b.errorCount;
        this.warningCount     = b.warningCount;
    }

    // ----------------------------------------------------------------
    // Rendering
    // ----------------------------------------------------------------

    /** Plain-text block for the execution log. */
    public String toLogSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(attemptNumber).append("\n");
        sb.append("  Strategy    : ").append(approach.getId()).append("\n");
        sb.append("  Outcome     : ").append(outcome).append("\n");
        if (rateLimitWaits > 0) {
            sb.append("  Rate waits  : ").append(rateLimitWaits).append("\n");
        }
        if (correctionIssued) {
            sb.append("  Correction  : issued for over-deletion\n");
        }

        switch (outcome) {
            case PASSED:
                sb.append("  Validation  : passed with ").append(warningCount).append(" warning(s)\n");
                break;
            case VALIDATION_FAILED:
                sb.append("  Validation  : ").append(errorCount).append(" error(s), ")
                  .append(warningCount).append(" warning(s)\n");
                if (error != null) sb.append("  First error : ").append(error).append("\n");
                break;
            case GENERATION_FAILED:
                sb.append("  Failure     : backend produced no output\n");
                if (error != null) sb.append("  Reason      : ").append(error).append("\n");
                break;
            case CANCELLED:
                sb.append("  Failure     : cancelled\n");
                break;
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int            getAttemptNumber()   { return attemptNumber; }
    public ChangeApproach getApproach()        { return approach; }
    public Outcome        getOutcome()         { return outcome; }
    public String         getError()           { return error; }
    public int            getRateLimitWaits()  { return rateLimitWaits; }
    public boolean        isCorrectionIssued() { return correctionIssued; }
    public int            getErrorCount()      { return errorCount; }
    public int            getWarningCount()    { return warningCount; }

    public boolean isPassed() {
        return outcome == Outcome.PASSED;
    }

    @Override
    public String toString() {
        return String.format("AttemptRecord{#%d %s %s}", attemptNumber, approach.getId(), outcome);
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int attemptNumber, ChangeApproach approach) {
        return new Builder(attemptNumber, approach);
    }

    public static final class Builder {
        private final int            attemptNumber;
        private final ChangeApproach approach;
        private Outcome outcome          = Outcome.GENERATION_FAILED;
        private String  error            = null;
        private int     rateLimitWaits   = 0;
        private boolean correctionIssued = false;
        private int     errorCount       = 0;
        private int     warningCount     = 0;

        private Builder(int attemptNumber, ChangeApproach approach) {
            this.attemptNumber = attemptNumber;
            this.approach      = approach;
        }

        public Builder outcome(Outcome v)           { this.outcome = v;          return this; }
        public Builder error(String v)              { this.error = v;            return this; }
        public Builder addRateLimitWaits(int v)     { this.rateLimitWaits += v;  return this; }
        public Builder correctionIssued(boolean v)  { this.correctionIssued = v; return this; }
        public Builder errorCount(int v)            { this.errorCount = v;       return this; }
        public Builder warningCount(int v)          { this.warningCount = v;     return this; }

        public AttemptRecord build() { return new AttemptRecord(this); }
    }
}
