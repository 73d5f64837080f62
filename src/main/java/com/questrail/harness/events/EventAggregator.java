package com.questrail.harness.events;

import com.questrail.harness.bus.BusSignal;
import com.questrail.harness.bus.MessageBus;
import com.questrail.harness.bus.Subscription;
import com.questrail.harness.time.MonotonicClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * EventAggregator
 * =============================================================================
 * Records the status and progress notifications of one session and lets the
 * scenario wait for quit conditions over them.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE --subscribe--&gt; SUBSCRIBED --abort--&gt; ABORTED
 *     \                    |                    |
 *      +-------------------+------close---------+--&gt; CLOSED
 * </pre>
 * While subscribed, every delivered notification is appended to the log and the
 * conditions of every registered waiter are rechecked; a waiter whose condition
 * now holds is woken through its own channel.
 *
 * <h2>Waiting</h2>
 * {@link #collectUntil(Collection, boolean)} first checks the buffered log
 * synchronously, so a notification that arrived before the call is never
 * missed and an already-satisfied call returns without recording wait time.
 * Blocking is a receive on the waiter's channel on the calling thread; the bus
 * loop keeps delivering meanwhile.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link #abort(String)} (the scenario deadline) makes pending and future
 *       unsatisfied waits raise {@link CollectTimeoutException}.</li>
 *   <li>A notification with missing or ill-typed arguments is recorded as an
 *       {@link AssertionError} and raised to every subsequent wait.</li>
 * </ul>
 */
public final class EventAggregator implements AutoCloseable {

    public static final String SESSION_INTERFACE = "org.syncevolution.Session";
    public static final String STATUS_CHANGED = "StatusChanged";
    public static final String PROGRESS_CHANGED = "ProgressChanged";

    public enum State {
        IDLE,
        SUBSCRIBED,
        ABORTED,
        CLOSED
    }

    private enum Wakeup {
        SATISFIED,
        ABORTED,
        FAILED,
        CLOSED
    }

    private final MessageBus bus;
    private final MonotonicClock clock;

    private final Object lock = new Object();
    private final List<SessionEvent> log = new ArrayList<>();
    private final List<Waiter> waiters = new ArrayList<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private State state = State.IDLE;
    private String abortReason;
    private AssertionError malformed;
    private long totalWaitNanos;

    public EventAggregator(MessageBus bus, MonotonicClock clock) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts recording notifications emitted by the session at {@code sessionPath}.
     */
    public void subscribe(String sessionPath) {
        Objects.requireNonNull(sessionPath, "sessionPath");
        synchronized (lock) {
            if (state == State.CLOSED) {
                throw new IllegalStateException("aggregator closed");
            }
            subscriptions.add(bus.subscribe(SESSION_INTERFACE, STATUS_CHANGED, sessionPath,
                    signal -> deliver(SessionEvent.Kind.STATUS, signal)));
            subscriptions.add(bus.subscribe(SESSION_INTERFACE, PROGRESS_CHANGED, sessionPath,
                    signal -> deliver(SessionEvent.Kind.PROGRESS, signal)));
            if (state == State.IDLE) {
                state = State.SUBSCRIBED;
            }
        }
    }

    /**
     * Waits until one of {@code conditions} holds.
     *
     * @param mayBlock {@code false} to only evaluate what is already buffered
     * @return the first satisfied condition, empty if none holds and
     *         {@code mayBlock} is {@code false}
     * @throws CollectTimeoutException if the aggregator was aborted first
     * @throws AssertionError          if a malformed notification was received
     */
    public Optional<QuitCondition> collectUntil(Collection<? extends QuitCondition> conditions, boolean mayBlock)
            throws InterruptedException
    {
        return await(conditions, mayBlock, -1L);
    }

    /**
     * Like {@link #collectUntil(Collection, boolean)} with an own time limit.
     *
     * @throws CollectTimeoutException if no condition held within {@code timeout}
     */
    public QuitCondition collectUntil(Collection<? extends QuitCondition> conditions, Duration timeout)
            throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        return await(conditions, true, Math.max(0L, timeout.toNanos())).orElseThrow();
    }

    /**
     * @return immutable snapshot of the log, in delivery order
     */
    public List<SessionEvent> events() {
        synchronized (lock) {
            return List.copyOf(log);
        }
    }

    /**
     * @return events with a sequence number of at least {@code index}
     */
    public List<SessionEvent> eventsSince(int index) {
        synchronized (lock) {
            if (index < 0) {
                throw new IllegalArgumentException("index must be >= 0");
            }
            return index >= log.size() ? List.of() : List.copyOf(log.subList(index, log.size()));
        }
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Total time callers spent blocked in {@code collectUntil}.
     */
    public Duration totalWaitTime() {
        synchronized (lock) {
            return Duration.ofNanos(totalWaitNanos);
        }
    }

    /**
     * Ends every pending and future unsatisfied wait with a
     * {@link CollectTimeoutException}. Notifications are still recorded.
     */
    public void abort(String reason) {
        synchronized (lock) {
            if (state == State.CLOSED || state == State.ABORTED) {
                return;
            }
            state = State.ABORTED;
            abortReason = Objects.requireNonNullElse(reason, "aborted");
            wakeAll(Wakeup.ABORTED);
        }
    }

    @Override
    public void close() {
        List<Subscription> toRemove;
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            toRemove = new ArrayList<>(subscriptions);
            subscriptions.clear();
            wakeAll(Wakeup.CLOSED);
        }
        toRemove.forEach(Subscription::remove);
    }

    private Optional<QuitCondition> await(Collection<? extends QuitCondition> conditions,
                                          boolean mayBlock,
                                          long timeoutNanos)
            throws InterruptedException
    {
        List<QuitCondition> wanted = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
        if (wanted.isEmpty()) {
            throw new IllegalArgumentException("conditions must not be empty");
        }

        Waiter waiter;
        synchronized (lock) {
            Optional<QuitCondition> done = check(wanted);
            if (done.isPresent() || !mayBlock) {
                return done;
            }
            waiter = new Waiter(wanted);
            waiters.add(waiter);
        }

        long start = clock.nowNanos();
        try {
            while (true) {
                Wakeup wakeup;
                try {
                    if (timeoutNanos < 0) {
                        wakeup = waiter.channel.take();
                    } else {
                        long remaining = timeoutNanos - (clock.nowNanos() - start);
                        wakeup = remaining > 0 ? waiter.channel.poll(remaining, TimeUnit.NANOSECONDS) : null;
                    }
                } catch (InterruptedException e) {
                    // The scenario deadline interrupts the waiting thread right after aborting.
                    synchronized (lock) {
                        if (state == State.ABORTED) {
                            Thread.currentThread().interrupt();
                            throw new CollectTimeoutException(
                                    "none of " + wanted + " held before abort: " + abortReason, log);
                        }
                    }
                    throw e;
                }
                synchronized (lock) {
                    Optional<QuitCondition> done = check(wanted);
                    if (done.isPresent()) {
                        return done;
                    }
                    if (wakeup == null) {
                        throw new CollectTimeoutException(
                                "none of " + wanted + " held within " + Duration.ofNanos(timeoutNanos),
                                log);
                    }
                }
            }
        } finally {
            synchronized (lock) {
                waiters.remove(waiter);
                totalWaitNanos += clock.nowNanos() - start;
            }
        }
    }

    /**
     * Evaluates {@code wanted} against the log; raises for terminal states.
     * Caller holds {@link #lock}.
     */
    private Optional<QuitCondition> check(List<QuitCondition> wanted) {
        if (malformed != null) {
            throw malformed;
        }
        QuitCondition satisfied = firstSatisfied(wanted);
        if (satisfied != null) {
            return Optional.of(satisfied);
        }
        if (state == State.ABORTED) {
            throw new CollectTimeoutException(
                    "none of " + wanted + " held before abort: " + abortReason, log);
        }
        if (state == State.CLOSED) {
            throw new IllegalStateException("aggregator closed while waiting for " + wanted);
        }
        return Optional.empty();
    }

    private QuitCondition firstSatisfied(List<QuitCondition> wanted) {
        List<SessionEvent> snapshot = List.copyOf(log);
        for (QuitCondition condition : wanted) {
            if (condition.isSatisfied(snapshot)) {
                return condition;
            }
        }
        return null;
    }

    private void deliver(SessionEvent.Kind kind, BusSignal signal) {
        long now = clock.nowNanos();
        synchronized (lock) {
            if (state == State.CLOSED) {
                return;
            }
            Map<String, Object> payload;
            try {
                payload = decode(kind, signal);
            } catch (AssertionError e) {
                if (malformed == null) {
                    malformed = e;
                }
                wakeAll(Wakeup.FAILED);
                return;
            }

            log.add(new SessionEvent(kind, payload, signal.path(), log.size(), now));
            List<SessionEvent> snapshot = List.copyOf(log);
            for (Waiter waiter : waiters) {
                for (QuitCondition condition : waiter.conditions) {
                    if (condition.isSatisfied(snapshot)) {
                        waiter.channel.offer(Wakeup.SATISFIED);
                        break;
                    }
                }
            }
        }
    }

    private void wakeAll(Wakeup wakeup) {
        for (Waiter waiter : waiters) {
            waiter.channel.offer(wakeup);
        }
    }

    /**
     * Decodes {@code StatusChanged(status, error, sources)} and
     * {@code ProgressChanged(progress, sources)}.
     */
    static Map<String, Object> decode(SessionEvent.Kind kind, BusSignal signal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (kind == SessionEvent.Kind.STATUS) {
            expectArity(signal, 3);
            payload.put("status", expect(signal, 0, String.class));
            payload.put("error", expect(signal, 1, Number.class).longValue());
            payload.put("sources", expect(signal, 2, Map.class));
        } else {
            expectArity(signal, 2);
            payload.put("progress", expect(signal, 0, Number.class).intValue());
            payload.put("sources", expect(signal, 1, Map.class));
        }
        return payload;
    }

    private static void expectArity(BusSignal signal, int arity) {
        if (signal.args().size() != arity) {
            throw new AssertionError(signal.member() + " from " + signal.path()
                    + " expected " + arity + " arguments, got " + signal.args());
        }
    }

    private static <T> T expect(BusSignal signal, int index, Class<T> type) {
        Object value = signal.args().get(index);
        if (!type.isInstance(value)) {
            throw new AssertionError(signal.member() + " from " + signal.path()
                    + " argument " + index + " should be " + type.getSimpleName() + ", got " + value);
        }
        return type.cast(value);
    }

    private static final class Waiter {
        private final List<QuitCondition> conditions;
        private final BlockingQueue<Wakeup> channel = new LinkedBlockingQueue<>();

        private Waiter(List<QuitCondition> conditions) {
            this.conditions = conditions;
        }
    }
}
