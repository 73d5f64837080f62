package com.questrail.harness.scenario;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Result of {@link ScenarioRunner#run(Scenario)}.
 *
 * @param name             scenario name
 * @param outcome          overall outcome
 * @param failure          primary failure, {@code null} when passed; later
 *                         problems are attached as suppressed exceptions
 * @param unresponsivePids pids that needed the forceful signal during cleanup
 * @param exitCode         exit code of the service, if one ran and exited
 * @param attachments      captured logs by name (bus traffic, output, events,
 *                         stack traces); populated on failure or abnormal exit
 * @param elapsed          wall time of the run including cleanup
 */
public record ScenarioResult(
    String name,
    ScenarioOutcome outcome,
    Throwable failure,
    List<Long> unresponsivePids,
    OptionalInt exitCode,
    Map<String, String> attachments,
    Duration elapsed
) {
    public ScenarioResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(exitCode, "exitCode");
        Objects.requireNonNull(elapsed, "elapsed");
        unresponsivePids = List.copyOf(unresponsivePids);
        attachments = Map.copyOf(attachments);
        if (outcome == ScenarioOutcome.PASSED && failure != null) {
            throw new IllegalArgumentException("passed result cannot carry a failure");
        }
    }

    public boolean passed() {
        return outcome == ScenarioOutcome.PASSED;
    }

    public String failureMessage() {
        if (failure == null) {
            return "";
        }
        return failure.getMessage() == null ? failure.getClass().getName() : failure.getMessage();
    }
}
