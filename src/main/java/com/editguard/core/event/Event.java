package com.editguard.core.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public class Event {

    private final String eventId;
    private final EventType type;
    private final String source;
    private final String requestId;

    // structured details; keys depend on the event type
    private final Map<String, Object> payload;

    private final Instant timestamp;

    public Event(EventType type, String source, String requestId, Map<String, Object> payload) {
        this.eventId = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.requestId = requestId;
        this.payload = payload != null ? Map.copyOf(payload) : Map.of();
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Event{" + type + " from " + source + ", request=" + requestId + ", " + payload + "}";
    }
}
