package com.questrail.harness.time;

import com.questrail.harness.loop.CooperativeLoop;

import java.util.Objects;

/**
 * {@link MonotonicScheduler} that arms the cooperative loop's native timer.
 *
 * <p>Tasks fire on the loop thread, serialized with bus deliveries. If the loop
 * is stuck, cooperative deadlines do not fire; scenario deadlines therefore use
 * {@link ThreadTimerBackend}.</p>
 */
public final class CooperativeTimerBackend implements MonotonicScheduler {

    private final CooperativeLoop loop;
    private final MonotonicClock clock;

    public CooperativeTimerBackend(CooperativeLoop loop, MonotonicClock clock) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");
        return loop.schedule(deadlineNanos - clock.nowNanos(), task);
    }
}
