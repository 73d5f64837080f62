package com.questrail.harness.observability;

import com.questrail.harness.process.ProcessSignal;

import java.time.Instant;

/**
 * Record describing one signal sent by the termination protocol.
 *
 * @param delivered {@code false} when the process no longer existed
 */
public record ProcessSignalEvent(
    Instant timestamp,
    long pid,
    ProcessSignal signal,
    boolean delivered
) {
}
