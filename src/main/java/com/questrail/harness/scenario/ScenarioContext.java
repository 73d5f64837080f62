package com.questrail.harness.scenario;

import com.questrail.harness.bus.MessageBus;
import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.events.EventAggregator;
import com.questrail.harness.supervisor.ServiceSupervisor;
import com.questrail.harness.time.MonotonicClock;
import com.questrail.harness.time.TimerWheel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-scenario view of the harness handed to a {@link ScenarioBody}.
 *
 * <p>Everything created through the context (aggregators, attachments) is
 * scoped to the scenario and released by the runner. When the scenario
 * deadline fires the context aborts its aggregators and interrupts the body
 * thread.</p>
 */
public final class ScenarioContext {

    private final String scenarioName;
    private final MessageBus bus;
    private final TimerWheel timers;
    private final MonotonicClock clock;
    private final ServiceSupervisor supervisor;
    private final HarnessConfig config;
    private final Thread bodyThread;

    private final List<EventAggregator> aggregators = new ArrayList<>();
    private final Map<String, String> attachments = new LinkedHashMap<>();
    private String abortReason;
    private boolean bodyRunning = true;

    ScenarioContext(String scenarioName,
                    MessageBus bus,
                    TimerWheel timers,
                    MonotonicClock clock,
                    ServiceSupervisor supervisor,
                    HarnessConfig config,
                    Thread bodyThread)
    {
        this.scenarioName = scenarioName;
        this.bus = bus;
        this.timers = timers;
        this.clock = clock;
        this.supervisor = supervisor;
        this.config = config;
        this.bodyThread = bodyThread;
    }

    public String scenarioName() {
        return scenarioName;
    }

    public MessageBus bus() {
        return bus;
    }

    public TimerWheel timers() {
        return timers;
    }

    public ServiceSupervisor supervisor() {
        return supervisor;
    }

    public HarnessConfig config() {
        return config;
    }

    /**
     * Creates an aggregator subscribed to the session at {@code sessionPath}.
     * An aggregator created after the deadline fired starts out aborted.
     */
    public synchronized EventAggregator newAggregator(String sessionPath) {
        EventAggregator aggregator = new EventAggregator(bus, clock);
        aggregator.subscribe(sessionPath);
        if (abortReason != null) {
            aggregator.abort(abortReason);
        }
        aggregators.add(aggregator);
        return aggregator;
    }

    /**
     * Adds a named text to the scenario's captured logs.
     */
    public synchronized void attach(String name, String content) {
        attachments.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(content, "content"));
    }

    public synchronized boolean isAborted() {
        return abortReason != null;
    }

    /**
     * @throws ScenarioAbortedException if the scenario deadline has fired
     */
    public synchronized void checkNotAborted() {
        if (abortReason != null) {
            throw new ScenarioAbortedException(abortReason);
        }
    }

    synchronized String abortReason() {
        return abortReason;
    }

    /**
     * Runs on the timer thread; must stay short.
     */
    synchronized void abort(String reason) {
        if (abortReason != null) {
            return;
        }
        abortReason = reason;
        for (EventAggregator aggregator : aggregators) {
            aggregator.abort(reason);
        }
        if (bodyRunning) {
            bodyThread.interrupt();
        }
    }

    /**
     * Marks the end of the body; later aborts no longer interrupt the thread.
     */
    synchronized void bodyFinished() {
        bodyRunning = false;
    }

    synchronized List<EventAggregator> aggregators() {
        return List.copyOf(aggregators);
    }

    synchronized Map<String, String> attachments() {
        return new LinkedHashMap<>(attachments);
    }

    synchronized void closeAggregators() {
        aggregators.forEach(EventAggregator::close);
    }
}
