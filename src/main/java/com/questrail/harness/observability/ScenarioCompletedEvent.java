package com.questrail.harness.observability;

import com.questrail.harness.scenario.ScenarioResult;

import java.time.Instant;

/**
 * Record emitted once a scenario's cleanup has finished.
 */
public record ScenarioCompletedEvent(
    Instant timestamp,
    ScenarioResult result
) {
    public boolean isFailure() {
        return !result.passed();
    }
}
