package com.questrail.harness.process;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of the termination protocol.
 *
 * <ul>
 *   <li><b>pollInterval</b>: longest sleep between exit checks during the grace period.</li>
 *   <li><b>killRetryInterval</b>: spacing of repeated forceful signals.</li>
 *   <li><b>killTimeout</b>: how long forceful signals are retried before the
 *       remaining processes are reported as survivors.</li>
 * </ul>
 */
public record TerminationTiming(
        Duration pollInterval,
        Duration killRetryInterval,
        Duration killTimeout
) {
    public TerminationTiming {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(killRetryInterval, "killRetryInterval");
        Objects.requireNonNull(killTimeout, "killTimeout");

        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (killRetryInterval.isNegative() || killRetryInterval.isZero()) {
            throw new IllegalArgumentException("killRetryInterval must be positive");
        }
        if (killTimeout.isNegative()) {
            throw new IllegalArgumentException("killTimeout must be non-negative");
        }
    }

    /**
     * pollInterval 100ms, killRetryInterval 100ms, killTimeout 5s.
     */
    public static TerminationTiming defaults() {
        return new TerminationTiming(
                Duration.ofMillis(100),
                Duration.ofMillis(100),
                Duration.ofSeconds(5)
        );
    }
}
