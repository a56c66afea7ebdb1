package com.editguard.llm;

import java.time.Duration;
import java.util.Optional;

/**
 * GenerationResult: typed outcome of a backend call.
 *
 * Backends report transport problems through the status instead of throwing:
 *   SUCCESS            content holds the raw model output
 *   RATE_LIMITED       retry the same call after the wait; does not count as an attempt
 *   TRANSIENT_FAILURE  timeout, 5xx, I/O or malformed response; the engine escalates
 *   PERMANENT_FAILURE  request rejected (4xx other than 429); the engine escalates
 *   CANCELLED          the call was cancelled or interrupted by the caller
 *
 * Always construct via the static factories.
 */
public final class GenerationResult {

    public enum Status {
        SUCCESS,
        RATE_LIMITED,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE,
        CANCELLED
    }

    private final Status   status;
    private final String   content;
    private final String   errorMessage;
    private final Duration retryAfter;   // only for RATE_LIMITED, nullable

    private GenerationResult(Status status, String content, String errorMessage, Duration retryAfter) {
        this.status       = status;
        this.content      = content != null ? content : "";
        this.errorMessage = errorMessage != null ? errorMessage : "";
        this.retryAfter   = retryAfter;
    }

    // =========================================================================
    // Static factories
    // =========================================================================

    public static GenerationResult success(String content) {
        return new GenerationResult(Status.SUCCESS, content, null, null);
    }

    /** @param retryAfter server-requested wait, or null to let the caller back off on its own schedule */
    public static GenerationResult rateLimited(Duration retryAfter, String message) {
        return new GenerationResult(Status.RATE_LIMITED, null, message, retryAfter);
    }

    public static GenerationResult transientFailure(String message) {
        return new GenerationResult(Status.TRANSIENT_FAILURE, null, message, null);
    }

    public static GenerationResult permanentFailure(String message) {
        return new GenerationResult(Status.PERMANENT_FAILURE, null, message, null);
    }

    public static GenerationResult cancelled(String message) {
        return new GenerationResult(Status.CANCELLED, null, message, null);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public Status             getStatus()       { return status; }
    public String             getContent()      { return content; }
    public String             getErrorMessage() { return errorMessage; }
    public Optional<Duration> getRetryAfter()   { return Optional.ofNullable(retryAfter); }

    public boolean isSuccess()     { return status == Status.SUCCESS; }
    public boolean isRateLimited() { return status == Status.RATE_LIMITED; }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "GenerationResult{SUCCESS, contentLen=" + content.length() + "}";
        }
        return String.format("GenerationResult{%s, error='%s'%s}", status, errorMessage,
                retryAfter != null ? ", retryAfter=" + retryAfter.toMillis() + "ms" : "");
    }
}
