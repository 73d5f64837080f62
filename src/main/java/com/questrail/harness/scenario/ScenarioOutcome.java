package com.questrail.harness.scenario;

public enum ScenarioOutcome {
    PASSED,
    /** Assertion failure, or a cleanup problem such as an unresponsive process. */
    FAILED,
    /** The whole-scenario deadline fired. */
    TIMED_OUT,
    /** Unexpected exception, including failure to start the service. */
    ERROR
}
