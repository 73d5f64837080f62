package com.questrail.harness.observability;

import com.questrail.harness.scenario.ScenarioPhase;

import java.time.Instant;

/**
 * Record representing a scenario lifecycle transition.
 */
public record ScenarioTransitionEvent(
    Instant timestamp,
    String scenario,
    ScenarioPhase oldPhase,
    ScenarioPhase newPhase
) {
}
