package com.questrail.harness.scenario;

/**
 * The scenario deadline fired while the body was still running.
 */
public class ScenarioAbortedException extends RuntimeException {

    public ScenarioAbortedException(String message) {
        super(message);
    }
}
