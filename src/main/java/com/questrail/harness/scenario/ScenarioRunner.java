package com.questrail.harness.scenario;

import com.questrail.harness.bus.BusTrafficLog;
import com.questrail.harness.bus.MessageBus;
import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.events.CollectTimeoutException;
import com.questrail.harness.events.EventAggregator;
import com.questrail.harness.events.SessionEvent;
import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.observability.ScenarioCompletedEvent;
import com.questrail.harness.observability.ScenarioTransitionEvent;
import com.questrail.harness.process.ProcessTree;
import com.questrail.harness.process.TerminationProtocol;
import com.questrail.harness.supervisor.ServiceHandle;
import com.questrail.harness.supervisor.ServiceSupervisor;
import com.questrail.harness.supervisor.StopResult;
import com.questrail.harness.time.Deadline;
import com.questrail.harness.time.MonotonicClock;
import com.questrail.harness.time.SystemWallClock;
import com.questrail.harness.time.TimerWheel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ScenarioRunner
 * =============================================================================
 * Runs one {@link Scenario} from service start to teardown.
 *
 * <h2>Sequence</h2>
 * <ol>
 *   <li>Arm the whole-scenario deadline on the timer thread. When it fires, the
 *       scenario's aggregators are aborted and the body thread is interrupted.</li>
 *   <li>Start the service, if the scenario names one, and run the body with a
 *       fresh {@link ScenarioContext}.</li>
 *   <li>On every exit path: cancel the deadline, close the aggregators, stop the
 *       service, drain timer callback failures, and attach the captured logs if
 *       the scenario failed or the service exited abnormally.</li>
 * </ol>
 *
 * <h2>Outcome</h2>
 * The first failure decides the outcome; cleanup problems (unresponsive
 * processes, abnormal exit, timer callback failures) turn a passing scenario
 * into {@link ScenarioOutcome#FAILED} and are otherwise added as suppressed
 * exceptions. A fired deadline always yields {@link ScenarioOutcome#TIMED_OUT}.
 * An {@link Error} other than {@link AssertionError} still goes through the
 * whole cleanup and is reported as {@link ScenarioOutcome#ERROR}, then rethrown
 * from {@link #run}.
 *
 * <p>Scenarios are run one at a time: timer callback failures are drained from
 * the shared {@link TimerWheel}.</p>
 */
public final class ScenarioRunner {

    private final HarnessConfig config;
    private final MessageBus bus;
    private final BusTrafficLog traffic;
    private final TimerWheel timers;
    private final ProcessTree tree;
    private final TerminationProtocol termination;
    private final MonotonicClock clock;
    private final HarnessObservabilitySink observabilitySink;

    public ScenarioRunner(HarnessConfig config,
                          MessageBus bus,
                          BusTrafficLog traffic,
                          TimerWheel timers,
                          ProcessTree tree,
                          TerminationProtocol termination,
                          MonotonicClock clock,
                          HarnessObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.traffic = traffic;
        this.timers = Objects.requireNonNull(timers, "timers");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.termination = Objects.requireNonNull(termination, "termination");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public ScenarioResult run(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario");
        long start = clock.nowNanos();
        String name = scenario.name();
        transition(name, null, ScenarioPhase.STARTING);

        ServiceSupervisor supervisor = new ServiceSupervisor(config, tree, termination, observabilitySink);
        ScenarioContext context = new ScenarioContext(
                name, bus, timers, clock, supervisor, config, Thread.currentThread());

        Duration timeout = scenario.timeout() != null ? scenario.timeout() : config.scenarioTimeout();
        Deadline deadline = timers.after(timeout,
                () -> context.abort("scenario " + name + " timed out after " + timeout),
                false);

        ScenarioOutcome outcome = ScenarioOutcome.PASSED;
        Throwable failure = null;
        ScenarioPhase phase = ScenarioPhase.STARTING;
        Error fatal = null;
        try {
            if (scenario.service() != null) {
                supervisor.start(scenario.service());
            }
            transition(name, phase, ScenarioPhase.RUNNING);
            phase = ScenarioPhase.RUNNING;
            scenario.body().run(context);
        } catch (AssertionError | CollectTimeoutException e) {
            outcome = ScenarioOutcome.FAILED;
            failure = e;
        } catch (Exception e) {
            outcome = ScenarioOutcome.ERROR;
            failure = e;
        } catch (Error e) {
            // Rethrown once the service is stopped and the result reported.
            outcome = ScenarioOutcome.ERROR;
            failure = e;
            fatal = e;
        } finally {
            context.bodyFinished();
            timers.cancel(deadline);
        }

        boolean externallyInterrupted = Thread.interrupted() && !context.isAborted();
        if (context.isAborted()) {
            outcome = ScenarioOutcome.TIMED_OUT;
            if (failure == null) {
                failure = new ScenarioAbortedException(context.abortReason());
            }
        }

        transition(name, phase, ScenarioPhase.CLEANING_UP);
        context.closeAggregators();

        StopResult stop;
        try {
            stop = supervisor.stop(config.shutdownGracePeriod());
        } catch (RuntimeException e) {
            observabilitySink.onError(new HarnessErrorEvent(
                    SystemWallClock.INSTANCE.now(), "Stopping service failed for " + name, e));
            stop = StopResult.notStarted();
            if (failure == null) {
                outcome = ScenarioOutcome.ERROR;
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        List<Throwable> problems = new ArrayList<>();
        for (Throwable timerFailure : timers.drainCallbackFailures()) {
            problems.add(new AssertionError("timer callback failed: " + timerFailure, timerFailure));
        }
        List<Long> unresponsive = stop.unresponsivePids();
        if (!unresponsive.isEmpty()) {
            problems.add(new AssertionError("processes needed forceful termination: " + unresponsive));
        }
        if (stop.exitedAbnormally()) {
            problems.add(new AssertionError("service exited abnormally with code " + stop.exitCode().getAsInt()));
        }
        for (Throwable problem : problems) {
            if (failure == null) {
                outcome = ScenarioOutcome.FAILED;
                failure = problem;
            } else {
                failure.addSuppressed(problem);
            }
        }

        Map<String, String> attachments = context.attachments();
        if (failure != null || stop.exitedAbnormally()) {
            attachments.putAll(captureLogs(supervisor, context, stop, failure));
        }

        ScenarioResult result = new ScenarioResult(
                name,
                outcome,
                failure,
                unresponsive,
                stop.exitCode(),
                attachments,
                Duration.ofNanos(clock.nowNanos() - start));

        transition(name, ScenarioPhase.CLEANING_UP, ScenarioPhase.COMPLETED);
        observabilitySink.onScenarioCompleted(new ScenarioCompletedEvent(SystemWallClock.INSTANCE.now(), result));

        if (externallyInterrupted) {
            Thread.currentThread().interrupt();
        }
        if (fatal != null) {
            throw fatal;
        }
        return result;
    }

    private Map<String, String> captureLogs(ServiceSupervisor supervisor,
                                            ScenarioContext context,
                                            StopResult stop,
                                            Throwable failure)
    {
        Map<String, String> logs = new LinkedHashMap<>();
        if (traffic != null) {
            logs.put("bus-traffic", traffic.render());
        }
        supervisor.handle().ifPresent(service -> addOutput(logs, "service", service));
        supervisor.auxiliaries().forEach((auxName, aux) -> addOutput(logs, auxName, aux));

        List<EventAggregator> aggregators = context.aggregators();
        for (int i = 0; i < aggregators.size(); i++) {
            logs.put("events-" + i, render(aggregators.get(i).events()));
        }
        if (failure instanceof CollectTimeoutException) {
            logs.put("events-at-timeout", ((CollectTimeoutException) failure).renderEvents());
        }
        stop.stackTraces().forEach((pid, trace) -> logs.put("stack-" + pid, trace));
        return logs;
    }

    private static void addOutput(Map<String, String> logs, String prefix, ServiceHandle handle) {
        logs.put(prefix + "-stdout", handle.stdout().render());
        logs.put(prefix + "-stderr", handle.stderr().render());
    }

    private static String render(List<SessionEvent> events) {
        StringBuilder sb = new StringBuilder();
        for (SessionEvent event : events) {
            sb.append(event).append('\n');
        }
        return sb.toString();
    }

    private void transition(String name, ScenarioPhase from, ScenarioPhase to) {
        observabilitySink.onScenarioTransition(new ScenarioTransitionEvent(
                SystemWallClock.INSTANCE.now(), name, from, to));
    }
}
