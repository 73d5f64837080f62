package com.questrail.harness.process;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one {@link TerminationProtocol#shutdown} run.
 *
 * @param outcomes         outcome per tracked pid
 * @param unresponsivePids pids that ignored the graceful signal and needed the forceful one
 * @param survivors        pids still present when forceful retries gave up
 * @param stackTraces      diagnostic stack traces captured before forceful kills
 * @param skippedPids      pids owned by another in-flight shutdown, not signalled
 */
public record ShutdownReport(
    Map<Long, TerminationOutcome> outcomes,
    List<Long> unresponsivePids,
    List<Long> survivors,
    Map<Long, String> stackTraces,
    List<Long> skippedPids
) {
    public ShutdownReport {
        outcomes = Map.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        unresponsivePids = List.copyOf(unresponsivePids);
        survivors = List.copyOf(survivors);
        stackTraces = Map.copyOf(stackTraces);
        skippedPids = List.copyOf(skippedPids);
    }

    public static ShutdownReport empty() {
        return new ShutdownReport(Map.of(), List.of(), List.of(), Map.of(), List.of());
    }

    /**
     * @return {@code true} if everything exited after the graceful signal
     */
    public boolean isClean() {
        return unresponsivePids.isEmpty() && survivors.isEmpty();
    }
}
