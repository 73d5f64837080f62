package com.questrail.harness.process;

import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.observability.ProcessSignalEvent;
import com.questrail.harness.time.MonotonicClock;
import com.questrail.harness.time.SystemWallClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * TerminationProtocol
 * =============================================================================
 * Escalating shutdown of a {@link ProcessSet}: graceful signal, grace period,
 * forceful signal.
 *
 * <h2>Per-process state machine</h2>
 * <pre>
 *   Running --(exited)------------------------------&gt; Exited
 *   Running --(grace elapsed)--&gt; StillRunning --(SIGKILL)--&gt; Exited | Unresponsive
 * </pre>
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>Claim every pid in the {@link SignalOwnership} registry; pids owned by
 *       another in-flight shutdown are skipped.</li>
 *   <li>Send the graceful signal once to every process.</li>
 *   <li>Poll with bounded sleeps until the grace period elapses, dropping
 *       processes that exited. Direct children of the harness are checked
 *       through their {@link ProcessHandle}; everything else by a non-blocking
 *       existence probe, since grandchildren cannot be waited for. A process
 *       whose parent changed is marked reparented and keeps being probed.</li>
 *   <li>For every process still present, capture a diagnostic stack trace,
 *       send the forceful signal, and repeat the forceful signal at short
 *       intervals until it is gone or the kill timeout elapses.</li>
 * </ol>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>"No such process" always counts as exited.</li>
 *   <li>Sleeps are plain {@link Thread#sleep}, independent of the event loop.</li>
 *   <li>Interruption does not cut cleanup short; the interrupt flag is restored
 *       on return.</li>
 *   <li>The run is bounded by grace period + kill timeout (+ stack capture).</li>
 * </ul>
 */
public final class TerminationProtocol {

    private final ProcessInspector inspector;
    private final ProcessSignaller signaller;
    private final StackTraceCollector stackTraces;
    private final SignalOwnership ownership;
    private final TerminationTiming timing;
    private final MonotonicClock clock;
    private final HarnessObservabilitySink observabilitySink;
    private final long selfPid = ProcessHandle.current().pid();

    public TerminationProtocol(ProcessInspector inspector,
                               ProcessSignaller signaller,
                               StackTraceCollector stackTraces,
                               SignalOwnership ownership,
                               TerminationTiming timing,
                               MonotonicClock clock,
                               HarnessObservabilitySink observabilitySink)
    {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.signaller = Objects.requireNonNull(signaller, "signaller");
        this.stackTraces = Objects.requireNonNull(stackTraces, "stackTraces");
        this.ownership = Objects.requireNonNull(ownership, "ownership");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Shuts down every process in {@code processes}.
     *
     * @param processes   processes to terminate
     * @param gracePeriod time allowed between the graceful and the forceful signal
     * @return report whose {@link ShutdownReport#unresponsivePids()} lists the
     *         pids that needed the forceful signal
     */
    public ShutdownReport shutdown(ProcessSet processes, Duration gracePeriod) {
        Objects.requireNonNull(processes, "processes");
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must be >= 0");
        }

        Map<Long, Tracked> pending = new LinkedHashMap<>();
        Map<Long, TerminationOutcome> outcomes = new LinkedHashMap<>();
        List<Long> skipped = new ArrayList<>();
        List<Long> claimed = new ArrayList<>();
        boolean interrupted = Thread.interrupted();

        try {
            for (ProcessRecord record : processes.records()) {
                if (record.pid() == selfPid) {
                    continue;
                }
                if (!ownership.claim(record.pid())) {
                    skipped.add(record.pid());
                    continue;
                }
                claimed.add(record.pid());
                pending.put(record.pid(), new Tracked(record));
            }

            // Graceful step: one signal per process.
            for (Tracked tracked : new ArrayList<>(pending.values())) {
                if (!signal(tracked.record.pid(), ProcessSignal.GRACEFUL)) {
                    pending.remove(tracked.record.pid());
                    outcomes.put(tracked.record.pid(), TerminationOutcome.EXITED_NORMALLY);
                }
            }

            long graceEnd = clock.nowNanos() + gracePeriod.toNanos();
            while (true) {
                reap(pending, outcomes, TerminationOutcome.EXITED_NORMALLY);
                long remaining = graceEnd - clock.nowNanos();
                if (pending.isEmpty() || remaining <= 0) {
                    break;
                }
                interrupted |= pause(Math.min(remaining, timing.pollInterval().toNanos()));
            }

            // Forceful step for whatever is left.
            Map<Long, String> traces = new LinkedHashMap<>();
            Set<Long> unresponsive = new LinkedHashSet<>();
            for (Tracked tracked : new ArrayList<>(pending.values())) {
                long pid = tracked.record.pid();
                stackTraces.capture(pid).ifPresent(trace -> traces.put(pid, trace));
                if (signal(pid, ProcessSignal.FORCEFUL)) {
                    unresponsive.add(pid);
                } else {
                    pending.remove(pid);
                    outcomes.put(pid, TerminationOutcome.EXITED_NORMALLY);
                }
            }

            long killEnd = clock.nowNanos() + timing.killTimeout().toNanos();
            while (true) {
                reap(pending, outcomes, TerminationOutcome.KILLED_FORCEFULLY);
                if (pending.isEmpty() || clock.nowNanos() - killEnd >= 0) {
                    break;
                }
                interrupted |= pause(timing.killRetryInterval().toNanos());
                for (Tracked tracked : pending.values()) {
                    signal(tracked.record.pid(), ProcessSignal.FORCEFUL);
                }
            }

            List<Long> survivors = new ArrayList<>();
            for (Tracked tracked : pending.values()) {
                survivors.add(tracked.record.pid());
                outcomes.put(tracked.record.pid(), tracked.reparented
                        ? TerminationOutcome.REPARENTED_PENDING
                        : TerminationOutcome.KILLED_FORCEFULLY);
            }

            return new ShutdownReport(outcomes, new ArrayList<>(unresponsive), survivors, traces, skipped);
        } finally {
            for (Long pid : claimed) {
                ownership.release(pid);
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean signal(long pid, ProcessSignal signal) {
        boolean delivered = signaller.send(pid, signal);
        observabilitySink.onProcessSignal(new ProcessSignalEvent(
                SystemWallClock.INSTANCE.now(), pid, signal, delivered));
        return delivered;
    }

    private void reap(Map<Long, Tracked> pending, Map<Long, TerminationOutcome> outcomes, TerminationOutcome onExit) {
        pending.values().removeIf(tracked -> {
            long pid = tracked.record.pid();
            if (hasExited(tracked)) {
                outcomes.put(pid, onExit);
                return true;
            }
            return false;
        });
    }

    private boolean hasExited(Tracked tracked) {
        long pid = tracked.record.pid();
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        boolean ownChild = handle
                .flatMap(ProcessHandle::parent)
                .map(parent -> parent.pid() == selfPid)
                .orElse(false);
        if (ownChild) {
            return !handle.get().isAlive();
        }

        Optional<ProcessRecord> current = inspector.find(pid);
        if (current.isEmpty()) {
            return true;
        }
        if (current.get().parentPid() != tracked.record.parentPid()) {
            tracked.reparented = true;
        }
        return false;
    }

    /**
     * Sleeps without giving up on interruption.
     *
     * @return {@code true} if the sleep was interrupted
     */
    private static boolean pause(long nanos) {
        if (nanos <= 0) {
            return false;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    private static final class Tracked {
        private final ProcessRecord record;
        private boolean reparented;

        private Tracked(ProcessRecord record) {
            this.record = record;
        }
    }
}
