package com.questrail.harness.scenario;

import com.questrail.harness.supervisor.ServiceCommand;

import java.time.Duration;
import java.util.Objects;

/**
 * One test case.
 *
 * @param name    name used in logs and results
 * @param service service to start before the body, {@code null} for none
 * @param timeout whole-scenario deadline, {@code null} for the configured default
 * @param body    test logic
 */
public record Scenario(
    String name,
    ServiceCommand service,
    Duration timeout,
    ScenarioBody body
) {
    public Scenario {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static Scenario of(String name, ScenarioBody body) {
        return new Scenario(name, null, null, body);
    }

    public Scenario withService(ServiceCommand command) {
        return new Scenario(name, command, timeout, body);
    }

    public Scenario withTimeout(Duration timeout) {
        return new Scenario(name, service, timeout, body);
    }
}
