package com.questrail.harness.runtime;

import com.questrail.harness.bus.BusTrafficLog;
import com.questrail.harness.bus.loopback.LoopbackMessageBus;
import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.loop.CooperativeLoop;
import com.questrail.harness.loop.netty.NettyCooperativeLoop;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.process.GdbStackTraceCollector;
import com.questrail.harness.process.ProcessHandleSignaller;
import com.questrail.harness.process.ProcessInspector;
import com.questrail.harness.process.ProcessInspectors;
import com.questrail.harness.process.ProcessSignaller;
import com.questrail.harness.process.ProcessTree;
import com.questrail.harness.process.SignalOwnership;
import com.questrail.harness.process.StackTraceCollector;
import com.questrail.harness.process.TerminationProtocol;
import com.questrail.harness.scenario.Scenario;
import com.questrail.harness.scenario.ScenarioResult;
import com.questrail.harness.scenario.ScenarioRunner;
import com.questrail.harness.time.MonotonicClock;
import com.questrail.harness.time.SystemMonotonicClock;
import com.questrail.harness.time.SystemWallClock;
import com.questrail.harness.time.TimerWheel;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HarnessRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the harness.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   NettyCooperativeLoop --&gt; LoopbackMessageBus (+ BusTrafficLog)
 *                       \--&gt; TimerWheel (cooperative + timer thread)
 *   ProcessInspector --&gt; ProcessTree, TerminationProtocol
 *   all of the above --&gt; ScenarioRunner
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runtime.start()        → marks the runtime usable
 *   runtime.run(scenario)  → runs one scenario, one at a time
 *   runtime.stop()         → stops the timer thread and the loop
 * </pre>
 */
public final class HarnessRuntime {
    private final HarnessConfig config;
    private final CooperativeLoop loop;
    private final BusTrafficLog traffic;
    private final LoopbackMessageBus bus;
    private final TimerWheel timers;
    private final ProcessTree processTree;
    private final ScenarioRunner runner;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HarnessRuntime(HarnessConfig config,
                           CooperativeLoop loop,
                           BusTrafficLog traffic,
                           LoopbackMessageBus bus,
                           TimerWheel timers,
                           ProcessTree processTree,
                           ScenarioRunner runner) {
        this.config = config;
        this.loop = loop;
        this.traffic = traffic;
        this.bus = bus;
        this.timers = timers;
        this.processTree = processTree;
        this.runner = runner;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("runtime already started");
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        timers.close();
        loop.shutdown();
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized ScenarioResult run(Scenario scenario) {
        if (!running.get()) {
            throw new IllegalStateException("runtime not started");
        }
        return runner.run(scenario);
    }

    public HarnessConfig config() {
        return config;
    }

    public LoopbackMessageBus bus() {
        return bus;
    }

    public BusTrafficLog traffic() {
        return traffic;
    }

    public TimerWheel timers() {
        return timers;
    }

    public ProcessTree processTree() {
        return processTree;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HarnessConfig config = HarnessConfig.defaults();
        private HarnessObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ProcessInspector inspector;
        private ProcessSignaller signaller = new ProcessHandleSignaller();
        private StackTraceCollector stackTraces;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private String loopThreadName = "harness-loop";

        public Builder withConfig(HarnessConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(HarnessObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withProcessInspector(ProcessInspector inspector) {
            this.inspector = inspector;
            return this;
        }

        public Builder withSignaller(ProcessSignaller signaller) {
            this.signaller = signaller;
            return this;
        }

        public Builder withStackTraceCollector(StackTraceCollector collector) {
            this.stackTraces = collector;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withLoopThreadName(String name) {
            this.loopThreadName = name;
            return this;
        }

        public HarnessRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(signaller, "signaller");
            Objects.requireNonNull(clock, "clock");
            HarnessObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Process plumbing
            ProcessInspector effectiveInspector = inspector != null ? inspector : ProcessInspectors.forCurrentPlatform();
            StackTraceCollector effectiveStackTraces = stackTraces != null
                    ? stackTraces
                    : config.captureStackTraces()
                        ? new GdbStackTraceCollector(config.stackTraceTimeout())
                        : StackTraceCollector.none();
            ProcessTree tree = new ProcessTree(effectiveInspector);
            TerminationProtocol termination = new TerminationProtocol(
                    effectiveInspector,
                    signaller,
                    effectiveStackTraces,
                    SignalOwnership.processWide(),
                    config.terminationTiming(),
                    clock,
                    sink);

            // 2. Loop, bus and timers
            CooperativeLoop loop = new NettyCooperativeLoop(loopThreadName);
            BusTrafficLog traffic = new BusTrafficLog(SystemWallClock.INSTANCE, config.busTrafficLines());
            LoopbackMessageBus bus = new LoopbackMessageBus(loop, traffic, sink);
            TimerWheel timers = new TimerWheel(loop, clock, sink);

            // 3. Scenario runner over all of it
            ScenarioRunner runner = new ScenarioRunner(config, bus, traffic, timers, tree, termination, clock, sink);

            return new HarnessRuntime(config, loop, traffic, bus, timers, tree, runner);
        }
    }
}
