package com.questrail.harness.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly reported by a harness component.
 */
public record HarnessErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
