package com.questrail.harness.supervisor;

import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.process.ProcessRecord;
import com.questrail.harness.process.ProcessSet;
import com.questrail.harness.process.ProcessTree;
import com.questrail.harness.process.ShutdownReport;
import com.questrail.harness.process.TerminationProtocol;
import com.questrail.harness.time.SystemWallClock;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;

/**
 * ServiceSupervisor
 * =============================================================================
 * Owns the lifecycle of one service under test and its auxiliary processes.
 *
 * <h2>Start</h2>
 * The command is prefixed with the configured launcher (normally
 * {@code setsid}) so the service leads its own process group. That group is
 * remembered and swept at stop time, which also reaches descendants that were
 * reparented after the launch process exited. Both output
 * streams are pumped into {@link OutputCapture}s, then the command's
 * {@link ReadinessProbe} is awaited for at most the readiness timeout. If the
 * service is not ready in time it is stopped and {@link ServiceStartException}
 * is thrown.
 *
 * <h2>Stop</h2>
 * <ol>
 *   <li>Resolve the real service pid. The launched process may be a wrapper;
 *       when the command names an executable signature, the first descendant
 *       running that executable is used instead.</li>
 *   <li>Discover the resolved pid's process set plus the launch process group,
 *       and add the launch process itself.</li>
 *   <li>Hand the set to the {@link TerminationProtocol}, then tear down every
 *       auxiliary process with the auxiliary grace period.</li>
 * </ol>
 * Auxiliary pids are excluded from service discovery. {@link #stop} is
 * idempotent: later calls return the first result.
 *
 * <p>Not thread-safe beyond {@code synchronized} entry points; one supervisor
 * per scenario.</p>
 */
public final class ServiceSupervisor {

    private static final Duration OUTPUT_DRAIN = Duration.ofSeconds(1);
    private static final Duration GROUP_SETTLE = Duration.ofMillis(500);
    private static final long GROUP_POLL_MILLIS = 10;

    private final HarnessConfig config;
    private final ProcessTree tree;
    private final TerminationProtocol termination;
    private final HarnessObservabilitySink observabilitySink;

    private final Map<String, ServiceHandle> auxiliaries = new LinkedHashMap<>();
    private ServiceCommand command;
    private ServiceHandle service;
    private long launchGroup = ProcessRecord.UNKNOWN_GROUP;
    private StopResult stopResult;

    public ServiceSupervisor(HarnessConfig config,
                             ProcessTree tree,
                             TerminationProtocol termination,
                             HarnessObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.termination = Objects.requireNonNull(termination, "termination");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Launches the service and waits for readiness.
     *
     * @throws ServiceStartException if the launch fails or readiness is not reached
     * @throws IllegalStateException if a service was already started
     */
    public synchronized ServiceHandle start(ServiceCommand command) throws InterruptedException {
        Objects.requireNonNull(command, "command");
        if (this.command != null) {
            throw new IllegalStateException("service already started: " + this.command.displayName());
        }
        this.command = command;

        List<String> argv = new ArrayList<>(config.launcherPrefix());
        argv.addAll(command.args());
        ServiceHandle handle = launch(command.displayName(), argv, command.environment(), command.workingDirectory());
        this.service = handle;
        if (launcherLeadsGroup()) {
            this.launchGroup = handle.pid();
        }

        boolean ready;
        try {
            ready = command.readiness().awaitReady(handle, config.readinessTimeout());
        } catch (InterruptedException e) {
            stop(config.shutdownGracePeriod());
            throw e;
        } catch (RuntimeException e) {
            stop(config.shutdownGracePeriod());
            throw new ServiceStartException("readiness probe failed for " + command.displayName(), e);
        }

        if (launchGroup == ProcessRecord.UNKNOWN_GROUP) {
            launchGroup = settleLaunchGroup(handle);
        }

        if (!ready) {
            OptionalInt exit = handle.exitCode();
            stop(config.shutdownGracePeriod());
            throw new ServiceStartException(command.displayName()
                    + (exit.isPresent()
                        ? " exited with code " + exit.getAsInt() + " before becoming ready"
                        : " not ready within " + config.readinessTimeout()));
        }
        return handle;
    }

    /**
     * Launches a side process that is stopped after the service.
     *
     * @throws ServiceStartException if the launch fails
     */
    public synchronized ServiceHandle startAuxiliary(String name, List<String> args) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        if (args.isEmpty()) {
            throw new IllegalArgumentException("args must not be empty");
        }
        if (auxiliaries.containsKey(name)) {
            throw new IllegalStateException("auxiliary already started: " + name);
        }
        ServiceHandle handle = launch(name, args, Map.of(), null);
        auxiliaries.put(name, handle);
        return handle;
    }

    public synchronized boolean isRunning() {
        return service != null && stopResult == null && service.isAlive();
    }

    /**
     * @return pid of the launched process, empty before {@link #start}
     */
    public synchronized OptionalLong pid() {
        return service == null ? OptionalLong.empty() : OptionalLong.of(service.pid());
    }

    public synchronized Optional<ServiceHandle> handle() {
        return Optional.ofNullable(service);
    }

    public synchronized Map<String, ServiceHandle> auxiliaries() {
        return Map.copyOf(auxiliaries);
    }

    /**
     * Stops the service, then the auxiliary processes. Safe to call when the
     * service never started or already exited.
     *
     * @param gracePeriod time the service gets to react to the graceful signal
     */
    public synchronized StopResult stop(Duration gracePeriod) {
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        if (stopResult != null) {
            return stopResult;
        }

        ShutdownReport serviceReport = ShutdownReport.empty();
        OptionalInt exitCode = OptionalInt.empty();
        boolean exitedBeforeStop = false;

        if (service != null) {
            exitedBeforeStop = !service.isAlive();
            List<Long> auxiliaryPids = new ArrayList<>();
            auxiliaries.values().forEach(aux -> auxiliaryPids.add(aux.pid()));
            ProcessTree serviceTree = tree.excluding(auxiliaryPids);

            long launchPid = service.pid();
            long resolved = resolveServicePid(serviceTree);
            ProcessSet processes = serviceTree.discover(resolved, trackedGroups(launchPid));
            if (resolved != launchPid && !processes.contains(launchPid)) {
                Optional<ProcessRecord> launchRecord = tree.inspector().find(launchPid);
                if (launchRecord.isPresent()) {
                    processes = processes.with(launchRecord.get());
                }
            }

            serviceReport = termination.shutdown(processes, gracePeriod);
            exitCode = awaitExitCode(service);
            awaitOutput(service);
        }

        Map<String, ShutdownReport> auxiliaryReports = new LinkedHashMap<>();
        for (Map.Entry<String, ServiceHandle> entry : auxiliaries.entrySet()) {
            ServiceHandle aux = entry.getValue();
            ProcessSet processes = tree.discover(aux.pid());
            auxiliaryReports.put(entry.getKey(), termination.shutdown(processes, config.auxiliaryGracePeriod()));
            awaitExitCode(aux);
            awaitOutput(aux);
        }

        stopResult = new StopResult(serviceReport, auxiliaryReports, exitCode, exitedBeforeStop);
        return stopResult;
    }

    /**
     * Finds the process running the service's executable below the launch pid.
     * Exact executable names win over names appearing anywhere on the command
     * line; without a match the launch pid is used.
     */
    long resolveServicePid(ProcessTree serviceTree) {
        long launchPid = service.pid();
        String signature = command.executableSignature();
        if (signature == null) {
            return launchPid;
        }
        ProcessSet descendants = serviceTree.discover(launchPid);
        for (ProcessRecord record : descendants.records()) {
            if (signature.equals(record.executableName())) {
                return record.pid();
            }
        }
        for (ProcessRecord record : descendants.records()) {
            for (String token : record.commandLine().split("\\s+")) {
                if (signature.equals(token.substring(token.lastIndexOf('/') + 1))) {
                    return record.pid();
                }
            }
        }
        return launchPid;
    }

    private Set<Long> trackedGroups(long launchPid) {
        long ownGroup = ownGroup();
        long group = launchGroup;
        if (group == ProcessRecord.UNKNOWN_GROUP || group == ownGroup) {
            group = groupOf(launchPid).orElse(ProcessRecord.UNKNOWN_GROUP);
        }
        if (group == ProcessRecord.UNKNOWN_GROUP || group == ownGroup) {
            return Set.of();
        }
        return Set.of(group);
    }

    /**
     * {@code setsid} execs the service as the leader of a new group, so the
     * launch pid is the group id.
     */
    private boolean launcherLeadsGroup() {
        List<String> prefix = config.launcherPrefix();
        if (prefix.isEmpty()) {
            return false;
        }
        String launcher = prefix.get(0);
        return "setsid".equals(launcher.substring(launcher.lastIndexOf('/') + 1));
    }

    /**
     * Reads the launch process's group once the launcher had time to move it
     * out of the harness's group. Without a launcher the service shares the
     * harness's group, which {@link #trackedGroups} never signals.
     */
    private long settleLaunchGroup(ServiceHandle handle) {
        long ownGroup = ownGroup();
        Optional<Long> group = groupOf(handle.pid());
        if (config.launcherPrefix().isEmpty()) {
            return group.orElse(ProcessRecord.UNKNOWN_GROUP);
        }
        long end = System.nanoTime() + GROUP_SETTLE.toNanos();
        while (group.isPresent() && group.get() == ownGroup && System.nanoTime() - end < 0) {
            try {
                Thread.sleep(GROUP_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            group = groupOf(handle.pid());
        }
        return group.orElse(ProcessRecord.UNKNOWN_GROUP);
    }

    private long ownGroup() {
        return groupOf(ProcessHandle.current().pid()).orElse(ProcessRecord.UNKNOWN_GROUP);
    }

    private Optional<Long> groupOf(long pid) {
        return tree.inspector().find(pid)
                .map(ProcessRecord::processGroupId)
                .filter(group -> group != ProcessRecord.UNKNOWN_GROUP);
    }

    private ServiceHandle launch(String name, List<String> argv, Map<String, String> environment, Path workingDirectory) {
        ProcessBuilder builder = new ProcessBuilder(argv);
        builder.redirectErrorStream(false);
        builder.environment().putAll(environment);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ServiceStartException("failed to launch " + argv, e);
        }

        OutputCapture stdout = new OutputCapture(name + "-stdout", config.outputTailLines(), this::reportPumpFailure);
        OutputCapture stderr = new OutputCapture(name + "-stderr", config.outputTailLines(), this::reportPumpFailure);
        stdout.pump(process.getInputStream());
        stderr.pump(process.getErrorStream());
        return new ServiceHandle(name, process, stdout, stderr);
    }

    private OptionalInt awaitExitCode(ServiceHandle handle) {
        try {
            return handle.awaitExit(config.terminationTiming().killTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return handle.exitCode();
        }
    }

    private void awaitOutput(ServiceHandle handle) {
        try {
            handle.stdout().awaitClosed(OUTPUT_DRAIN);
            handle.stderr().awaitClosed(OUTPUT_DRAIN);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void reportPumpFailure(IOException e) {
        observabilitySink.onError(new HarnessErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Output capture failed",
                e));
    }
}
