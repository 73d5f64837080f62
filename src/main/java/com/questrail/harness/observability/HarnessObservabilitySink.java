package com.questrail.harness.observability;

/**
 * Main interface for receiving harness observability events.
 * Implementations can provide logging, metrics, or report collection.
 */
public interface HarnessObservabilitySink {
    /**
     * Called when a scenario moves between lifecycle phases.
     * @param event the transition details
     */
    void onScenarioTransition(ScenarioTransitionEvent event);

    /**
     * Called whenever the termination protocol delivers (or fails to deliver)
     * a signal to a tracked process.
     * @param event the signal details
     */
    void onProcessSignal(ProcessSignalEvent event);

    /**
     * Called once per scenario after cleanup has finished.
     * @param event the final scenario result
     */
    void onScenarioCompleted(ScenarioCompletedEvent event);

    /**
     * Called when an error or anomaly occurs outside the scenario body:
     * timer callback failures, output pump failures, cleanup problems.
     * @param event the error event
     */
    void onError(HarnessErrorEvent event);
}
