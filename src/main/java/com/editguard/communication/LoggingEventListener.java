package com.editguard.communication;

import com.editguard.core.event.Event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes every pipeline event to the log. Failures and escalations at WARN, the rest at INFO/DEBUG. */
@Component
public class LoggingEventListener implements PipelineEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(Event event) {
        switch (event.getType()) {
            case PIPELINE_FAILED, STRATEGY_ESCALATED, RATE_LIMIT_WAIT ->
                    log.warn("[Event] {} request={} {}", event.getType(), event.getRequestId(), event.getPayload());
            case ATTEMPT_STARTED, ATTEMPT_VALIDATED ->
                    log.debug("[Event] {} request={} {}", event.getType(), event.getRequestId(), event.getPayload());
            default ->
                    log.info("[Event] {} request={} {}", event.getType(), event.getRequestId(), event.getPayload());
        }
    }
}
