package com.questrail.harness.scenario;

/**
 * The test logic of a scenario. Runs on the caller's thread; the service, if
 * any, is already running and ready.
 */
@FunctionalInterface
public interface ScenarioBody {
    void run(ScenarioContext context) throws Exception;
}
