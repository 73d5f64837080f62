package com.questrail.harness.runtime;

import com.questrail.harness.bus.BusSignal;
import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.events.EventAggregator;
import com.questrail.harness.events.QuitCondition;
import com.questrail.harness.observability.Slf4jHarnessObservabilitySink;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HarnessRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() {
        HarnessRuntime runtime = HarnessRuntime.builder()
            .withConfig(HarnessConfig.builder().withScenarioTimeout(Duration.ofSeconds(10)).build())
            .withObservabilitySink(new Slf4jHarnessObservabilitySink())
            .build();

        assertThrows(IllegalStateException.class, () -> runtime.run(Scenario.of("early", context -> { })));

        runtime.start();
        try {
            String session = "/org/syncevolution/Session/smoke";
            runtime.bus().export("/org/syncevolution/Server", "org.syncevolution.Server", "StartSession", args -> {
                runtime.bus().emit(BusSignal.of(EventAggregator.SESSION_INTERFACE,
                        EventAggregator.PROGRESS_CHANGED, session, 100, Map.of()));
                return session;
            });

            ScenarioResult result = runtime.run(Scenario.of("smoke", context -> {
                EventAggregator events = context.newAggregator(session);
                Object path = context.bus().call("/org/syncevolution/Server", "org.syncevolution.Server",
                        "StartSession", List.of("config"));
                assertEquals(session, path);
                events.collectUntil(List.of(QuitCondition.progressAtLeast(100)), true);
            }));

            assertTrue(result.passed(), result.failureMessage());
            assertTrue(runtime.traffic().lines().stream().anyMatch(line -> line.contains("StartSession")));
        } finally {
            runtime.stop();
        }
        assertFalse(runtime.isRunning());
    }
}
