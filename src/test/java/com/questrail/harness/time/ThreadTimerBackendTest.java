package com.questrail.harness.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ThreadTimerBackendTest
 * -----------------------------------------------------------------------------
 * Real-time tests of the heap-driven timer thread.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ThreadTimerBackendTest {

    private final ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
    private ThreadTimerBackend backend;

    @BeforeEach
    void setUp() {
        backend = new ThreadTimerBackend("test-timer", SystemMonotonicClock.INSTANCE, failures::add);
        backend.start();
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void deadlinesIssuedInReverseOrderFireInDeadlineOrder() throws InterruptedException {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        AtomicLong twoSecondsAt = new AtomicLong();
        AtomicLong fiveSecondsAt = new AtomicLong();
        CountDownLatch done = new CountDownLatch(2);

        long start = System.nanoTime();
        backend.scheduleAfter(Duration.ofSeconds(5), SystemMonotonicClock.INSTANCE, () -> {
            fiveSecondsAt.set(System.nanoTime() - start);
            fired.add("5s");
            done.countDown();
        });
        backend.scheduleAfter(Duration.ofSeconds(2), SystemMonotonicClock.INSTANCE, () -> {
            twoSecondsAt.set(System.nanoTime() - start);
            fired.add("2s");
            done.countDown();
        });

        assertTrue(done.await(10, TimeUnit.SECONDS), "both deadlines should fire");
        assertEquals(List.of("2s", "5s"), fired);
        assertEquals(2.0, twoSecondsAt.get() / 1e9, 1.0);
        assertEquals(5.0, fiveSecondsAt.get() / 1e9, 1.0);
    }

    @Test
    void dueDeadlineFiresSynchronouslyOnInsertion() {
        AtomicBoolean fired = new AtomicBoolean(false);
        Thread caller = Thread.currentThread();
        AtomicBoolean onCaller = new AtomicBoolean(false);

        backend.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> {
            onCaller.set(Thread.currentThread() == caller);
            fired.set(true);
        });

        assertTrue(fired.get(), "already-due entry fires before scheduleAtNanos returns");
        assertTrue(onCaller.get());
    }

    @Test
    void cancelledEntryNeverFiresAndLeavesTheHeap() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);
        Cancellable handle = backend.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
                () -> fired.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel());
        assertEquals(0, backend.pendingCount());

        Thread.sleep(300);
        assertFalse(fired.get());
    }

    @Test
    void failingCallbackDoesNotStopTheThread() throws InterruptedException {
        CountDownLatch later = new CountDownLatch(1);
        backend.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE,
                () -> { throw new IllegalStateException("boom"); });
        backend.scheduleAfter(Duration.ofMillis(80), SystemMonotonicClock.INSTANCE, later::countDown);

        assertTrue(later.await(2, TimeUnit.SECONDS), "timer thread keeps rearming after a failure");
        assertEquals(1, failures.size());
    }

    @Test
    void assertionErrorInCallbackDoesNotStopTheThread() throws InterruptedException {
        CountDownLatch later = new CountDownLatch(1);
        backend.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE,
                () -> { throw new AssertionError("checked on the timer thread"); });
        backend.scheduleAfter(Duration.ofMillis(80), SystemMonotonicClock.INSTANCE, later::countDown);

        assertTrue(later.await(2, TimeUnit.SECONDS), "timer thread survives a failed assertion");
        assertEquals(1, failures.size());
        assertInstanceOf(AssertionError.class, failures.peek());
    }

    @Test
    void callbackInsertingDueEntryRunsItInOrder() throws InterruptedException {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(1);
        backend.scheduleAfter(Duration.ofMillis(30), SystemMonotonicClock.INSTANCE, () -> {
            fired.add("outer");
            backend.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> {
                fired.add("inner");
                done.countDown();
            });
        });

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("outer", "inner"), fired);
    }

    @Test
    void closedBackendRejectsNewEntries() {
        backend.close();
        assertThrows(IllegalStateException.class,
                () -> backend.scheduleAfter(Duration.ofSeconds(1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
