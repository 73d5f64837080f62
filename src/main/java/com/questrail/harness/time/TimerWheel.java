package com.questrail.harness.time;

import com.questrail.harness.loop.CooperativeLoop;
import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TimerWheel
 * =============================================================================
 * Deferred-callback scheduling with two backends.
 *
 * <h2>Backends</h2>
 * <ul>
 *   <li><b>Cooperative</b> (default): arms the cooperative loop's native timer;
 *       the callback runs on the loop thread, serialized with bus deliveries.</li>
 *   <li><b>Thread</b>: a min-heap served by a dedicated timer thread. Fires even
 *       when the loop is stuck, which is why scenario deadlines use it. A
 *       zero-delay deadline fires synchronously inside {@link #after}.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * A callback that throws does not affect other deadlines. The failure is
 * reported to the observability sink and kept until
 * {@link #drainCallbackFailures()} hands it to the scenario.
 */
public final class TimerWheel implements AutoCloseable
{
    private final MonotonicClock clock;
    private final MonotonicScheduler cooperative;
    private final MonotonicScheduler threaded;
    private final AutoCloseable threadedResource;
    private final HarnessObservabilitySink observabilitySink;

    private final AtomicLong nextSequence = new AtomicLong();
    private final Queue<Throwable> callbackFailures = new ConcurrentLinkedQueue<>();

    /**
     * Creates a wheel over the given loop with its own timer thread.
     */
    public TimerWheel(CooperativeLoop loop, MonotonicClock clock, HarnessObservabilitySink observabilitySink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.cooperative = new CooperativeTimerBackend(Objects.requireNonNull(loop, "loop"), clock);

        ThreadTimerBackend backend = new ThreadTimerBackend("harness-timer", clock, this::recordFailure);
        backend.start();
        this.threaded = backend;
        this.threadedResource = backend;
    }

    /**
     * Creates a wheel over explicit backends. The wheel does not own them.
     */
    public TimerWheel(MonotonicScheduler cooperative,
                      MonotonicScheduler threaded,
                      MonotonicClock clock,
                      HarnessObservabilitySink observabilitySink)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cooperative = Objects.requireNonNull(cooperative, "cooperative");
        this.threaded = Objects.requireNonNull(threaded, "threaded");
        this.threadedResource = null;
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Arms a cooperative deadline.
     */
    public Deadline after(Duration delay, Runnable callback)
    {
        return after(delay, callback, true);
    }

    /**
     * Arms a deadline {@code delay} from now.
     *
     * @param delay       non-negative delay
     * @param callback    callback to run once
     * @param cooperative {@code true} for the loop backend, {@code false} for the timer thread
     * @return handle accepted by {@link #cancel(Deadline)}
     */
    public Deadline after(Duration delay, Runnable callback, boolean cooperative)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(callback, "callback");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long fireTime = clock.nowNanos() + delay.toNanos();
        Deadline deadline = new Deadline(
                fireTime,
                nextSequence.getAndIncrement(),
                callback,
                cooperative ? Deadline.Backend.COOPERATIVE : Deadline.Backend.THREAD);

        MonotonicScheduler backend = cooperative ? this.cooperative : this.threaded;
        deadline.arm(backend.scheduleAtNanos(fireTime, () -> fire(deadline)));
        return deadline;
    }

    /**
     * Cancels a deadline. Safe to call with {@code null}, twice, or after the
     * deadline fired; none of these invoke the callback.
     *
     * @return {@code true} only if this call prevented the callback from running
     */
    public boolean cancel(Deadline deadline)
    {
        if (deadline == null) {
            return false;
        }
        return deadline.markCancelled();
    }

    /**
     * Returns and clears the callback failures collected so far, oldest first.
     */
    public List<Throwable> drainCallbackFailures()
    {
        List<Throwable> drained = new ArrayList<>();
        Throwable next;
        while ((next = callbackFailures.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    @Override
    public void close()
    {
        if (threadedResource != null) {
            try {
                threadedResource.close();
            } catch (Exception e) {
                recordFailure(e);
            }
        }
    }

    private void fire(Deadline deadline)
    {
        if (!deadline.markFired()) {
            return;
        }
        try {
            deadline.callback().run();
        } catch (RuntimeException | AssertionError e) {
            recordFailure(e);
        }
    }

    private void recordFailure(Throwable failure)
    {
        callbackFailures.add(failure);
        observabilitySink.onError(new HarnessErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Timer callback failed",
                failure));
    }
}
