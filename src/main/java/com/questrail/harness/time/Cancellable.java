package com.questrail.harness.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a deferred callback.
 *
 * <p>
 * Implemented by both timer backends (cooperative loop timers and the
 * heap-driven timer thread) and by the deterministic test scheduler.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
