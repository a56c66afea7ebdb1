package com.editguard.communication;

import com.editguard.core.event.Event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous fan-out on the publishing thread. A failing listener is logged
 * and skipped so one bad observer cannot fail a pipeline run.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final CopyOnWriteArrayList<PipelineEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[EventBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), e.getMessage());
            }
        }
    }

    @Override
    public void subscribe(PipelineEventListener listener) {
        listeners.addIfAbsent(listener);
    }
}
