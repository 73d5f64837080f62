package com.questrail.harness.supervisor;

import com.questrail.harness.bus.BusTrafficLog;
import com.questrail.harness.bus.loopback.LoopbackMessageBus;
import com.questrail.harness.config.HarnessConfig;
import com.questrail.harness.loop.netty.NettyCooperativeLoop;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.process.ProcessInspector;
import com.questrail.harness.process.ProcessInspectors;
import com.questrail.harness.process.ProcessHandleSignaller;
import com.questrail.harness.process.ProcessRecord;
import com.questrail.harness.process.ProcessSet;
import com.questrail.harness.process.ProcessTree;
import com.questrail.harness.process.ProcfsProcessInspector;
import com.questrail.harness.process.SignalOwnership;
import com.questrail.harness.process.StackTraceCollector;
import com.questrail.harness.process.TerminationProtocol;
import com.questrail.harness.time.SystemMonotonicClock;
import com.questrail.harness.time.SystemWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * ServiceSupervisorTest
 * -----------------------------------------------------------------------------
 * Launches real child processes; Linux only.
 */
@EnabledOnOs(OS.LINUX)
class ServiceSupervisorTest {

    private HarnessConfig config;
    private ProcessInspector inspector;
    private ServiceSupervisor supervisor;

    @BeforeEach
    void setUp() {
        config = HarnessConfig.builder()
                .withReadinessTimeout(Duration.ofSeconds(5))
                .withShutdownGracePeriod(Duration.ofSeconds(2))
                .withAuxiliaryGracePeriod(Duration.ofSeconds(1))
                .build();
        inspector = ProcessInspectors.forCurrentPlatform();
        supervisor = newSupervisor();
    }

    @AfterEach
    void tearDown() {
        supervisor.stop(Duration.ZERO);
    }

    @Test
    void discoveredSetContainsTheServiceButNotTheHarness() throws Exception {
        ServiceHandle handle = supervisor.start(ServiceCommand.of("sleep", "30"));

        ProcessSet set = new ProcessTree(inspector).discover(handle.pid());

        assertTrue(set.contains(handle.pid()));
        assertFalse(set.contains(ProcessHandle.current().pid()));
        assertTrue(supervisor.isRunning());
        assertEquals(handle.pid(), supervisor.pid().getAsLong());
    }

    @Test
    void cooperativeServiceStopsCleanly() throws Exception {
        supervisor.start(ServiceCommand.of("sleep", "30"));

        StopResult result = supervisor.stop(Duration.ofSeconds(2));

        assertEquals(List.of(), result.unresponsivePids());
        assertFalse(result.exitedBeforeStop());
        assertEquals(OptionalInt.of(143), result.exitCode(), "death by SIGTERM");
        assertFalse(result.exitedAbnormally());
        assertFalse(supervisor.isRunning());
    }

    @Test
    void serviceIgnoringTermIsReportedUnresponsive() throws Exception {
        ServiceHandle handle = supervisor.start(ServiceCommand
                .of("sh", "-c", "trap '' TERM; echo ready; read line")
                .withReadiness(ReadinessProbe.firstOutputLine()));

        StopResult result = supervisor.stop(Duration.ofSeconds(2));

        assertEquals(List.of(handle.pid()), result.unresponsivePids());
        assertFalse(inspector.exists(handle.pid()));
        assertFalse(result.exitedAbnormally(), "SIGKILL is an expected way to end");
    }

    @Test
    void stopIsIdempotent() throws Exception {
        supervisor.start(ServiceCommand.of("sleep", "30"));

        StopResult first = supervisor.stop(Duration.ofSeconds(2));
        StopResult second = supervisor.stop(Duration.ofSeconds(2));

        assertSame(first, second);
    }

    @Test
    void stopWithoutStartIsHarmless() {
        StopResult result = supervisor.stop(Duration.ofSeconds(1));

        assertTrue(result.service().isClean());
        assertTrue(result.exitCode().isEmpty());
    }

    @Test
    void readinessWaitsForFirstOutputLine() throws Exception {
        ServiceHandle handle = supervisor.start(ServiceCommand
                .of("sh", "-c", "sleep 0.2; echo listening; exec sleep 30")
                .withReadiness(ReadinessProbe.firstOutputLine()));

        assertEquals(List.of("listening"), handle.stdout().lines());
    }

    @Test
    void serviceExitingBeforeReadinessFailsToStart() {
        ServiceStartException e = assertThrows(ServiceStartException.class, () -> supervisor.start(ServiceCommand
                .of("sh", "-c", "echo failing >&2; exit 3")
                .withReadiness(ReadinessProbe.firstOutputLine())));

        assertTrue(e.getMessage().contains("exited with code 3")
                || e.getMessage().contains("not ready"), e.getMessage());
        assertFalse(supervisor.isRunning());
    }

    @Test
    void unknownExecutableFailsToStart() {
        supervisor = newSupervisorWithoutLauncher();
        assertThrows(ServiceStartException.class,
                () -> supervisor.start(ServiceCommand.of("/nonexistent/service-binary")));
    }

    @Test
    void abnormalExitIsClassified() throws Exception {
        ServiceHandle handle = supervisor.start(ServiceCommand.of("sh", "-c", "exit 7"));
        handle.awaitExit(Duration.ofSeconds(5));

        StopResult result = supervisor.stop(Duration.ofSeconds(1));

        assertTrue(result.exitedBeforeStop());
        assertEquals(OptionalInt.of(7), result.exitCode());
        assertTrue(result.exitedAbnormally());
    }

    @Test
    void wrapperScriptIsResolvedToTheRealService() throws Exception {
        ServiceHandle wrapper = supervisor.start(ServiceCommand
                .of("sh", "-c", "sleep 30; true")
                .withExecutableSignature("sleep"));
        long sleepPid = awaitChild(wrapper.pid(), "sleep");

        long resolved = supervisor.resolveServicePid(new ProcessTree(inspector));

        assertEquals(sleepPid, resolved);
        StopResult result = supervisor.stop(Duration.ofSeconds(2));
        assertTrue(result.service().outcomes().containsKey(wrapper.pid()), "wrapper is shut down too");
        assertTrue(result.service().outcomes().containsKey(sleepPid));
        assertFalse(inspector.exists(sleepPid));
    }

    @Test
    void auxiliaryProcessIsStoppedAfterTheService() throws Exception {
        supervisor.start(ServiceCommand.of("sleep", "30"));
        ServiceHandle aux = supervisor.startAuxiliary("log-capture", List.of("sleep", "30"));

        StopResult result = supervisor.stop(Duration.ofSeconds(2));

        assertTrue(result.auxiliaries().containsKey("log-capture"));
        assertFalse(result.service().outcomes().containsKey(aux.pid()), "auxiliary is not part of the service set");
        assertFalse(aux.isAlive());
    }

    @Test
    void orphanLeftInTheServiceGroupIsStopped() throws Exception {
        assumeGroupTracking();
        ServiceHandle handle = supervisor.start(ServiceCommand.of("sh", "-c", "sleep 300 & exit 0"));
        long group = handle.pid();
        long orphan = awaitGroupMember(group, "sleep");
        assertTrue(handle.awaitExit(Duration.ofSeconds(5)).isPresent(), "launch shell exits right away");

        StopResult result = supervisor.stop(Duration.ofSeconds(2));

        assertTrue(result.service().outcomes().containsKey(orphan), "orphan found through the launch group");
        assertFalse(inspector.exists(orphan));
        assertEquals(List.of(), groupMembers(group));
        assertEquals(List.of(), result.unresponsivePids());
        assertFalse(result.exitedAbnormally());
    }

    @Test
    void grandchildIgnoringTermIsKilledAndReported() throws Exception {
        assumeGroupTracking();
        ServiceHandle handle = supervisor.start(ServiceCommand
                .of("sh", "-c", "(trap '' TERM; exec sleep 300) & exit 0"));
        long group = handle.pid();
        long stubborn = awaitGroupMember(group, "sleep");
        handle.awaitExit(Duration.ofSeconds(5));

        StopResult result = supervisor.stop(Duration.ofSeconds(1));

        assertEquals(List.of(stubborn), result.unresponsivePids());
        assertFalse(inspector.exists(stubborn));
        assertEquals(List.of(), groupMembers(group));
    }

    @Test
    void readinessCallWithoutReplyFailsWithinTheTimeout() {
        NettyCooperativeLoop loop = new NettyCooperativeLoop("test-readiness-loop");
        CountDownLatch release = new CountDownLatch(1);
        try {
            LoopbackMessageBus bus = new LoopbackMessageBus(loop,
                    new BusTrafficLog(SystemWallClock.INSTANCE, 100), NullObservabilitySink.INSTANCE);
            bus.export("/server", "org.example.Server", "Ping", args -> {
                release.await();
                return null;
            });
            config = config.toBuilder().withReadinessTimeout(Duration.ofMillis(500)).build();
            supervisor = newSupervisor();
            ServiceCommand command = ServiceCommand.of("sleep", "30")
                    .withReadiness(ReadinessProbe.remoteCall(bus, "/server", "org.example.Server", "Ping",
                            Duration.ofMillis(50)));

            long start = System.nanoTime();
            ServiceStartException e = assertThrows(ServiceStartException.class, () -> supervisor.start(command));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertTrue(e.getMessage().contains("not ready within"), e.getMessage());
            assertTrue(elapsed.compareTo(Duration.ofSeconds(4)) < 0, "start took " + elapsed);
            assertFalse(supervisor.isRunning());
        } finally {
            release.countDown();
            loop.shutdown();
        }
    }

    private void assumeGroupTracking() {
        assumeTrue(!config.launcherPrefix().isEmpty(), "setsid not installed");
        assumeTrue(inspector instanceof ProcfsProcessInspector, "process groups not visible");
    }

    private long awaitGroupMember(long group, String executable) throws InterruptedException {
        long end = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < end) {
            for (ProcessRecord record : inspector.snapshot()) {
                if (record.processGroupId() == group && executable.equals(record.executableName())) {
                    return record.pid();
                }
            }
            Thread.sleep(20);
        }
        throw new AssertionError("no " + executable + " in group " + group);
    }

    private List<Long> groupMembers(long group) {
        return inspector.snapshot().stream()
                .filter(record -> record.processGroupId() == group)
                .map(ProcessRecord::pid)
                .collect(Collectors.toList());
    }

    private long awaitChild(long parentPid, String executable) throws InterruptedException {
        long end = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < end) {
            for (var record : new ProcessTree(inspector).discover(parentPid).records()) {
                if (record.pid() != parentPid && executable.equals(record.executableName())) {
                    return record.pid();
                }
            }
            Thread.sleep(20);
        }
        throw new AssertionError("no " + executable + " below " + parentPid);
    }

    private ServiceSupervisor newSupervisor() {
        return new ServiceSupervisor(config, new ProcessTree(inspector), termination(), NullObservabilitySink.INSTANCE);
    }

    private ServiceSupervisor newSupervisorWithoutLauncher() {
        HarnessConfig bare = config.toBuilder().withLauncherPrefix(List.of()).build();
        return new ServiceSupervisor(bare, new ProcessTree(inspector), termination(), NullObservabilitySink.INSTANCE);
    }

    private TerminationProtocol termination() {
        return new TerminationProtocol(inspector, new ProcessHandleSignaller(), StackTraceCollector.none(),
                SignalOwnership.processWide(), config.terminationTiming(), SystemMonotonicClock.INSTANCE,
                NullObservabilitySink.INSTANCE);
    }
}
