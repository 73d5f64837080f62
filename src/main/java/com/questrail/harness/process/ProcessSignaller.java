package com.questrail.harness.process;

/**
 * Delivers termination signals to individual processes.
 */
public interface ProcessSignaller
{
    /**
     * @return {@code true} if the signal was delivered; {@code false} if the
     *         process no longer exists
     */
    boolean send(long pid, ProcessSignal signal);
}
