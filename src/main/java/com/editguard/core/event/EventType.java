package com.editguard.core.event;

public enum EventType {
    ANALYSIS_STARTED,
    ASSESSMENT_COMPLETED,
    ATTEMPT_STARTED,
    ATTEMPT_VALIDATED,
    STRATEGY_ESCALATED,
    RATE_LIMIT_WAIT,
    EXECUTION_COMPLETED,
    DRY_RUN_COMPLETED,
    PIPELINE_FAILED
}
