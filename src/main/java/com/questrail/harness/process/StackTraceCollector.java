package com.questrail.harness.process;

import java.util.Optional;

/**
 * Best-effort diagnostic capture taken right before a process is killed
 * forcefully. Failures yield an empty result, never an exception.
 */
@FunctionalInterface
public interface StackTraceCollector
{
    Optional<String> capture(long pid);

    static StackTraceCollector none()
    {
        return pid -> Optional.empty();
    }
}
