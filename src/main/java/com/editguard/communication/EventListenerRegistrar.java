package com.editguard.communication;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Subscribes every PipelineEventListener bean once the context is ready. */
@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final EventBus                    eventBus;
    private final List<PipelineEventListener> pipelineListeners;

    public EventListenerRegistrar(EventBus eventBus, List<PipelineEventListener> pipelineListeners) {
        this.eventBus          = eventBus;
        this.pipelineListeners = pipelineListeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void subscribeAll() {
        pipelineListeners.forEach(eventBus::subscribe);
        log.info("[EventBus] {} pipeline listener(s) subscribed: {}", pipelineListeners.size(),
                pipelineListeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.toList()));
    }
}
