package com.editguard.core;

/**
 * Fatal, non-retryable failure of a pipeline run: the request could not even be
 * assessed or turned into a prompt. Caught at the orchestrator boundary.
 */
public class PipelineException extends RuntimeException {

    private final String stage;

    public PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineException(String stage, String message) {
        this(stage, message, null);
    }

    public String getStage() {
        return stage;
    }
}
