package com.questrail.harness.events;

import java.util.List;

/**
 * No quit condition held before the wait was cut short, either by the
 * scenario deadline or by an explicit timeout.
 * <p>
 * Carries the full event log buffered at that point.
 */
public class CollectTimeoutException extends RuntimeException {

    private final List<SessionEvent> events;

    public CollectTimeoutException(String message, List<SessionEvent> events) {
        super(message);
        this.events = List.copyOf(events);
    }

    public List<SessionEvent> events() {
        return events;
    }

    public String renderEvents() {
        StringBuilder sb = new StringBuilder();
        for (SessionEvent event : events) {
            sb.append(event).append('\n');
        }
        return sb.toString();
    }
}
