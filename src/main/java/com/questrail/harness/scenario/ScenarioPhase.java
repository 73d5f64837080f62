package com.questrail.harness.scenario;

/**
 * Lifecycle phases of a scenario run.
 */
public enum ScenarioPhase {
    STARTING,
    RUNNING,
    CLEANING_UP,
    COMPLETED
}
