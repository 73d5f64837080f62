package com.questrail.harness.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for diagnostics: bus traffic timestamps,
 * observability events and scenario reports.
 *
 * <p>
 * It MUST NOT be used to decide when a deadline fires or a grace period ends.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
