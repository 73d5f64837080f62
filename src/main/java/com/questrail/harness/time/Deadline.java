package com.questrail.harness.time;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deadline
 * =============================================================================
 * Handle for one deferred callback armed through {@link TimerWheel}.
 *
 * <h2>State</h2>
 * A deadline starts {@link State#PENDING} and leaves that state at most once,
 * either to {@link State#FIRED} or to {@link State#CANCELLED}. The callback
 * therefore runs at most once regardless of how many times the backend or the
 * caller races on it.
 *
 * <h2>Ordering</h2>
 * Deadlines compare by fire time, then by the sequence number the wheel
 * assigned at insertion.
 */
public final class Deadline implements Comparable<Deadline>
{
    public enum Backend
    {
        /** Fired by the cooperative loop's native timer, on the loop thread. */
        COOPERATIVE,
        /** Fired by the dedicated timer thread's min-heap. */
        THREAD
    }

    public enum State
    {
        PENDING,
        FIRED,
        CANCELLED
    }

    private final long fireTimeNanos;
    private final long sequence;
    private final Runnable callback;
    private final Backend backend;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    private volatile Cancellable armed;

    Deadline(long fireTimeNanos, long sequence, Runnable callback, Backend backend)
    {
        this.fireTimeNanos = fireTimeNanos;
        this.sequence = sequence;
        this.callback = Objects.requireNonNull(callback, "callback");
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    public long fireTimeNanos()
    {
        return fireTimeNanos;
    }

    public long sequence()
    {
        return sequence;
    }

    public Backend backend()
    {
        return backend;
    }

    public State state()
    {
        return state.get();
    }

    public boolean isPending()
    {
        return state.get() == State.PENDING;
    }

    Runnable callback()
    {
        return callback;
    }

    void arm(Cancellable backendHandle)
    {
        this.armed = backendHandle;
        // Cancelled between scheduling and arming: release the backend slot now.
        if (state.get() == State.CANCELLED && backendHandle != null) {
            backendHandle.cancel();
        }
    }

    boolean markFired()
    {
        return state.compareAndSet(State.PENDING, State.FIRED);
    }

    boolean markCancelled()
    {
        if (!state.compareAndSet(State.PENDING, State.CANCELLED)) {
            return false;
        }
        Cancellable handle = armed;
        if (handle != null) {
            handle.cancel();
        }
        return true;
    }

    @Override
    public int compareTo(Deadline o)
    {
        int byTime = Long.compare(fireTimeNanos, o.fireTimeNanos);
        return byTime != 0 ? byTime : Long.compare(sequence, o.sequence);
    }

    @Override
    public String toString()
    {
        return "Deadline{seq=" + sequence + ", backend=" + backend + ", state=" + state.get() + '}';
    }
}
