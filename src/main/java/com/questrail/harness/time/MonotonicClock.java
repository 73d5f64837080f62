package com.questrail.harness.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every harness deadline, grace period and poll interval.
 *
 * <h2>Binding invariant</h2>
 * Deadlines, termination grace periods and readiness timeouts MUST be computed
 * from a monotonic source. Wall-clock time is permitted only for diagnostics
 * (traffic logs, report timestamps).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
