package com.questrail.harness.loop;

import com.questrail.harness.time.Cancellable;

/**
 * CooperativeLoop
 * =============================================================================
 * The single cooperative event loop that drives bus deliveries and
 * cooperative timers.
 *
 * <h2>Serialization</h2>
 * Every task submitted through {@link #execute(Runnable)} and every timer armed
 * through {@link #schedule(long, Runnable)} runs on one loop thread, one at a
 * time. Tasks submitted from the same thread run in submission order.
 *
 * <p>Implementations may be backed by Netty, a plain single-thread executor, or
 * a test double. Framework types MUST NOT escape the implementation package.</p>
 */
public interface CooperativeLoop
{
    /**
     * Enqueue a task for execution on the loop thread.
     */
    void execute(Runnable task);

    /**
     * Arm a native loop timer.
     *
     * @param delayNanos relative delay, clamped to zero when negative
     * @param task       task to run on the loop thread once the delay elapses
     * @return cancellation handle for the armed timer
     */
    Cancellable schedule(long delayNanos, Runnable task);

    /**
     * @return {@code true} if the calling thread is the loop thread
     */
    boolean inLoop();

    /**
     * Stop the loop. Pending tasks and timers are discarded.
     */
    void shutdown();
}
