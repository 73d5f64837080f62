package com.questrail.harness.supervisor;

import com.questrail.harness.process.ShutdownReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Outcome of {@link ServiceSupervisor#stop}.
 *
 * @param service          shutdown of the service's process set
 * @param auxiliaries      shutdown per auxiliary process name
 * @param exitCode         exit code of the launched process, if it was observed
 * @param exitedBeforeStop the service had already exited when stop began
 */
public record StopResult(
    ShutdownReport service,
    Map<String, ShutdownReport> auxiliaries,
    OptionalInt exitCode,
    boolean exitedBeforeStop
) {
    /**
     * Exit codes expected from a stopped service: clean exit, or death by
     * SIGINT, SIGKILL or SIGTERM.
     */
    public static final Set<Integer> EXPECTED_EXIT_CODES = Set.of(0, 130, 137, 143);

    public StopResult {
        auxiliaries = Map.copyOf(auxiliaries);
    }

    public static StopResult notStarted() {
        return new StopResult(ShutdownReport.empty(), Map.of(), OptionalInt.empty(), false);
    }

    /**
     * @return pids that needed the forceful signal, service first
     */
    public List<Long> unresponsivePids() {
        List<Long> pids = new ArrayList<>(service.unresponsivePids());
        auxiliaries.values().forEach(report -> pids.addAll(report.unresponsivePids()));
        return pids;
    }

    /**
     * @return stack traces captured before forceful kills, keyed by pid
     */
    public Map<Long, String> stackTraces() {
        Map<Long, String> traces = new java.util.LinkedHashMap<>(service.stackTraces());
        auxiliaries.values().forEach(report -> traces.putAll(report.stackTraces()));
        return traces;
    }

    public boolean exitedAbnormally() {
        return exitCode.isPresent() && !EXPECTED_EXIT_CODES.contains(exitCode.getAsInt());
    }
}
