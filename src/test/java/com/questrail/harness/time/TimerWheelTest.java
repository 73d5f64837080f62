package com.questrail.harness.time;

import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimerWheelTest
 * -----------------------------------------------------------------------------
 * Ordering, cancellation and failure handling of the wheel, with both backends
 * replaced by deterministic schedulers on a manual clock.
 */
class TimerWheelTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler cooperative;
    private DeterministicScheduler threaded;
    private RecordingObservabilitySink sink;
    private TimerWheel wheel;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        cooperative = new DeterministicScheduler(clock);
        threaded = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        wheel = new TimerWheel(cooperative, threaded, clock, sink);
    }

    @Test
    void earlierDeadlineFiresFirstRegardlessOfInsertionOrder() {
        List<String> fired = new ArrayList<>();
        wheel.after(Duration.ofSeconds(5), () -> fired.add("late"));
        wheel.after(Duration.ofSeconds(2), () -> fired.add("early"));

        clock.advance(Duration.ofSeconds(2));
        cooperative.runDueTasks();
        assertEquals(List.of("early"), fired);

        clock.advance(Duration.ofSeconds(3));
        cooperative.runDueTasks();
        assertEquals(List.of("early", "late"), fired);
    }

    @Test
    void equalDeadlinesFireInInsertionOrder() {
        List<Integer> fired = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            wheel.after(Duration.ofMillis(100), () -> fired.add(n));
        }
        clock.advance(Duration.ofMillis(100));
        cooperative.runDueTasks();
        assertEquals(List.of(0, 1, 2, 3, 4), fired);
    }

    @Test
    void deadlineDoesNotFireEarly() {
        AtomicInteger count = new AtomicInteger();
        wheel.after(Duration.ofMillis(500), count::incrementAndGet);

        clock.advance(Duration.ofMillis(499));
        cooperative.runDueTasks();
        assertEquals(0, count.get());

        clock.advance(Duration.ofMillis(1));
        cooperative.runDueTasks();
        assertEquals(1, count.get());
    }

    @Test
    void cancelIsIdempotentAndPreventsFiring() {
        AtomicInteger count = new AtomicInteger();
        Deadline deadline = wheel.after(Duration.ofSeconds(1), count::incrementAndGet);

        assertTrue(wheel.cancel(deadline));
        assertFalse(wheel.cancel(deadline));
        assertEquals(Deadline.State.CANCELLED, deadline.state());

        clock.advance(Duration.ofSeconds(2));
        cooperative.runDueTasks();
        assertEquals(0, count.get());
    }

    @Test
    void cancelAfterFiringHasNoEffect() {
        AtomicInteger count = new AtomicInteger();
        Deadline deadline = wheel.after(Duration.ofSeconds(1), count::incrementAndGet);

        clock.advance(Duration.ofSeconds(1));
        cooperative.runDueTasks();

        assertFalse(wheel.cancel(deadline));
        assertEquals(Deadline.State.FIRED, deadline.state());
        assertEquals(1, count.get());
    }

    @Test
    void cancelNullIsHarmless() {
        assertFalse(wheel.cancel(null));
    }

    @Test
    void threadBackendIsChosenByFlag() {
        AtomicInteger cooperativeCount = new AtomicInteger();
        AtomicInteger threadCount = new AtomicInteger();

        Deadline onLoop = wheel.after(Duration.ofMillis(10), cooperativeCount::incrementAndGet, true);
        Deadline onThread = wheel.after(Duration.ofMillis(10), threadCount::incrementAndGet, false);
        assertEquals(Deadline.Backend.COOPERATIVE, onLoop.backend());
        assertEquals(Deadline.Backend.THREAD, onThread.backend());

        clock.advance(Duration.ofMillis(10));
        threaded.runDueTasks();
        assertEquals(0, cooperativeCount.get());
        assertEquals(1, threadCount.get());

        cooperative.runDueTasks();
        assertEquals(1, cooperativeCount.get());
    }

    @Test
    void failingCallbackIsCollectedAndOthersStillFire() {
        List<String> fired = new ArrayList<>();
        wheel.after(Duration.ofMillis(10), () -> { throw new IllegalStateException("boom"); });
        wheel.after(Duration.ofMillis(20), () -> fired.add("after"));

        clock.advance(Duration.ofMillis(20));
        cooperative.runDueTasks();

        assertEquals(List.of("after"), fired);
        List<Throwable> failures = wheel.drainCallbackFailures();
        assertEquals(1, failures.size());
        assertEquals("boom", failures.get(0).getMessage());
        assertTrue(wheel.drainCallbackFailures().isEmpty(), "drain clears the failures");
        assertTrue(sink.hasEventOfType(HarnessErrorEvent.class));
    }

    @Test
    void assertionErrorsInCallbacksAreCollectedToo() {
        wheel.after(Duration.ZERO, () -> { throw new AssertionError("expected 1"); });
        cooperative.runDueTasks();

        List<Throwable> failures = wheel.drainCallbackFailures();
        assertEquals(1, failures.size());
        assertInstanceOf(AssertionError.class, failures.get(0));
    }

    @Test
    void callbackMayArmFurtherDeadlines() {
        List<String> fired = new ArrayList<>();
        wheel.after(Duration.ofMillis(10), () -> {
            fired.add("first");
            wheel.after(Duration.ZERO, () -> fired.add("nested"));
        });

        clock.advance(Duration.ofMillis(10));
        cooperative.runDueTasks();
        assertEquals(List.of("first", "nested"), fired);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> wheel.after(Duration.ofMillis(-1), () -> {}));
    }
}
