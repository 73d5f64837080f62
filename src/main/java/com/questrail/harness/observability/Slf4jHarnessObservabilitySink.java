package com.questrail.harness.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HarnessObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHarnessObservabilitySink implements HarnessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHarnessObservabilitySink.class);

    @Override
    public void onScenarioTransition(ScenarioTransitionEvent event) {
        log.info("Scenario {}: {} -> {}",
            event.scenario(),
            event.oldPhase(),
            event.newPhase());
    }

    @Override
    public void onProcessSignal(ProcessSignalEvent event) {
        if (event.delivered()) {
            log.info("Sent {} signal to pid {}", event.signal(), event.pid());
        } else {
            log.debug("Pid {} already gone, {} signal not delivered", event.pid(), event.signal());
        }
    }

    @Override
    public void onScenarioCompleted(ScenarioCompletedEvent event) {
        var result = event.result();
        if (event.isFailure()) {
            log.warn("Scenario {} finished {} after {}: {}",
                result.name(),
                result.outcome(),
                result.elapsed(),
                result.failureMessage());
            if (!result.unresponsivePids().isEmpty()) {
                log.warn("Scenario {} needed forceful kill for pids {}", result.name(), result.unresponsivePids());
            }
        } else {
            log.info("Scenario {} passed after {}", result.name(), result.elapsed());
        }
    }

    @Override
    public void onError(HarnessErrorEvent event) {
        log.error("Harness error: {}", event.message(), event.cause());
    }
}
