package com.editguard.communication;

import com.editguard.core.event.Event;
import com.editguard.core.event.EventType;

import java.util.Map;

/**
 * Observability sink for pipeline progress. Publishing must never fail a run:
 * implementations isolate listener errors.
 */
public interface EventBus {

    void publish(Event event);

    void subscribe(PipelineEventListener listener);

    default void publish(EventType type, String source, String requestId, Map<String, Object> payload) {
        publish(new Event(type, source, requestId, payload));
    }
}
