package com.questrail.harness.events;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One session notification as observed by an {@link EventAggregator}.
 *
 * @param kind            status or progress notification
 * @param payload         decoded signal arguments ({@code status}, {@code error},
 *                        {@code progress}, {@code sources})
 * @param sourcePath      object path of the emitting session
 * @param sequence        zero-based position in the aggregator's log
 * @param receivedAtNanos monotonic time of delivery
 */
public record SessionEvent(
    Kind kind,
    Map<String, Object> payload,
    String sourcePath,
    long sequence,
    long receivedAtNanos
) {
    public enum Kind {
        STATUS,
        PROGRESS
    }

    public SessionEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sourcePath, "sourcePath");
        payload = Map.copyOf(Objects.requireNonNull(payload, "payload"));
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    /**
     * @return the session status for {@link Kind#STATUS} events, e.g. {@code "done"}
     */
    public Optional<String> status() {
        return kind == Kind.STATUS ? Optional.of((String) payload.get("status")) : Optional.empty();
    }

    /**
     * @return overall progress percentage for {@link Kind#PROGRESS} events
     */
    public OptionalInt progress() {
        return kind == Kind.PROGRESS ? OptionalInt.of((Integer) payload.get("progress")) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + kind + " " + sourcePath + " " + payload;
    }
}
