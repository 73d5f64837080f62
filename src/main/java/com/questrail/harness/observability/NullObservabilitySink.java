package com.questrail.harness.observability;

/**
 * No-op implementation of HarnessObservabilitySink.
 */
public final class NullObservabilitySink implements HarnessObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onScenarioTransition(ScenarioTransitionEvent event) {}

    @Override
    public void onProcessSignal(ProcessSignalEvent event) {}

    @Override
    public void onScenarioCompleted(ScenarioCompletedEvent event) {}

    @Override
    public void onError(HarnessErrorEvent event) {}
}
