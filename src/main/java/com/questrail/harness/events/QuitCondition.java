package com.questrail.harness.events;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate over the accumulated session event log that ends a wait in
 * {@link EventAggregator#collectUntil}.
 * <p>
 * Conditions are re-evaluated against the whole log after every new event, so
 * they must be side-effect free.
 */
@FunctionalInterface
public interface QuitCondition
{
    boolean isSatisfied(List<SessionEvent> events);

    /**
     * Wraps a predicate with a description used in timeout reports.
     */
    static QuitCondition named(String description, Predicate<List<SessionEvent>> predicate)
    {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(predicate, "predicate");
        return new QuitCondition() {
            @Override
            public boolean isSatisfied(List<SessionEvent> events)
            {
                return predicate.test(events);
            }

            @Override
            public String toString()
            {
                return description;
            }
        };
    }

    /**
     * Some status notification reported {@code status}.
     */
    static QuitCondition statusIs(String status)
    {
        Objects.requireNonNull(status, "status");
        return named("status is " + status, events -> events.stream()
                .anyMatch(e -> e.status().map(status::equals).orElse(false)));
    }

    /**
     * Some progress notification reached at least {@code percent}.
     */
    static QuitCondition progressAtLeast(int percent)
    {
        return named("progress >= " + percent, events -> events.stream()
                .anyMatch(e -> e.progress().orElse(Integer.MIN_VALUE) >= percent));
    }

    /**
     * At least {@code count} notifications of {@code kind} arrived.
     */
    static QuitCondition countAtLeast(SessionEvent.Kind kind, int count)
    {
        Objects.requireNonNull(kind, "kind");
        return named(count + "+ " + kind + " events", events -> events.stream()
                .filter(e -> e.kind() == kind)
                .count() >= count);
    }

    /**
     * Satisfied as soon as one of {@code conditions} is.
     */
    static QuitCondition anyOf(QuitCondition... conditions)
    {
        List<QuitCondition> all = List.of(conditions);
        return named("any of " + all, events -> all.stream().anyMatch(c -> c.isSatisfied(events)));
    }
}
