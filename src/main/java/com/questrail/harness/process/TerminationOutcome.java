package com.questrail.harness.process;

/**
 * How one tracked process ended during a shutdown.
 */
public enum TerminationOutcome {
    /** Exited after the graceful signal, or was already gone. */
    EXITED_NORMALLY,
    /** Needed the forceful signal. */
    KILLED_FORCEFULLY,
    /**
     * Reparented away from its original parent and still present when the
     * protocol gave up; it cannot be reaped by us and disappears only once init
     * reaps it.
     */
    REPARENTED_PENDING
}
