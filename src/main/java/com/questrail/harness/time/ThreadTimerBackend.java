package com.questrail.harness.time;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * ThreadTimerBackend
 * =============================================================================
 * Min-heap timer driven by a dedicated timer thread and a condition variable
 * armed to the earliest deadline.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>On wake, every due entry is popped and run in deadline order; the thread
 *       then rearms for the new heap top, never less than one millisecond ahead.</li>
 *   <li>Entries whose deadline is already due at insertion are fired
 *       synchronously on the inserting thread before {@link #scheduleAtNanos}
 *       returns.</li>
 *   <li>Callbacks may insert new entries while firing. Firing is serialized by a
 *       reentrant lock, so a callback that inserts an already-due entry runs it
 *       nested, still in deadline order.</li>
 *   <li>A callback failure is handed to the failure handler and never stops the
 *       thread from rearming.</li>
 * </ul>
 *
 * <h2>Callback constraints</h2>
 * Callbacks run on the timer thread. They must be short and must not block:
 * set a flag, offer to a queue, interrupt a thread.
 */
public final class ThreadTimerBackend implements MonotonicScheduler, AutoCloseable {

    private static final long MIN_REARM_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final String threadName;
    private final MonotonicClock clock;
    private final Consumer<Throwable> failureHandler;

    private final ReentrantLock heapLock = new ReentrantLock();
    private final Condition rearm = heapLock.newCondition();
    private final ReentrantLock firingLock = new ReentrantLock();
    private final PriorityQueue<Entry> heap = new PriorityQueue<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private long nextSequence;
    private boolean running = true;
    private volatile Thread timerThread;

    public ThreadTimerBackend(String threadName, MonotonicClock clock, Consumer<Throwable> failureHandler) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    /**
     * Starts the timer thread. Idempotent.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::runTimerThread, threadName);
            t.setDaemon(true);
            timerThread = t;
            t.start();
        }
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        Entry entry;
        heapLock.lock();
        try {
            if (!running) {
                throw new IllegalStateException("timer thread " + threadName + " is closed");
            }
            entry = new Entry(deadlineNanos, nextSequence++, task);
            heap.add(entry);
            rearm.signal();
        } finally {
            heapLock.unlock();
        }

        if (deadlineNanos - clock.nowNanos() <= 0) {
            fireDue();
        }
        return entry;
    }

    /**
     * @return number of entries still waiting in the heap
     */
    public int pendingCount() {
        heapLock.lock();
        try {
            return heap.size();
        } finally {
            heapLock.unlock();
        }
    }

    /**
     * Stops the timer thread and drops every pending entry.
     */
    @Override
    public void close() {
        heapLock.lock();
        try {
            running = false;
            heap.clear();
            rearm.signalAll();
        } finally {
            heapLock.unlock();
        }

        Thread t = timerThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runTimerThread() {
        while (true) {
            heapLock.lock();
            try {
                if (!running) {
                    return;
                }
                Entry top = heap.peek();
                if (top == null) {
                    rearm.await();
                    continue;
                }
                long waitNanos = top.deadlineNanos - clock.nowNanos();
                if (waitNanos > 0) {
                    rearm.awaitNanos(Math.max(waitNanos, MIN_REARM_NANOS));
                    continue;
                }
            } catch (InterruptedException e) {
                // Interrupting the timer thread is treated as a shutdown request.
                Thread.currentThread().interrupt();
                return;
            } finally {
                heapLock.unlock();
            }

            fireDue();
        }
    }

    private void fireDue() {
        firingLock.lock();
        try {
            List<Entry> due = popDue();
            while (!due.isEmpty()) {
                for (Entry entry : due) {
                    entry.fire();
                }
                // Callbacks may have inserted entries that are already due.
                due = popDue();
            }
        } finally {
            firingLock.unlock();
        }
    }

    private List<Entry> popDue() {
        List<Entry> due = new ArrayList<>();
        heapLock.lock();
        try {
            long now = clock.nowNanos();
            while (!heap.isEmpty() && heap.peek().deadlineNanos - now <= 0) {
                due.add(heap.poll());
            }
        } finally {
            heapLock.unlock();
        }
        return due;
    }

    private final class Entry implements Comparable<Entry>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Entry(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        private void fire() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                task.run();
            } catch (RuntimeException | AssertionError e) {
                failureHandler.accept(e);
            }
        }

        @Override
        public boolean cancel() {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            heapLock.lock();
            try {
                heap.remove(this);
            } finally {
                heapLock.unlock();
            }
            return true;
        }

        @Override
        public int compareTo(Entry o) {
            int byDeadline = Long.compare(deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, o.sequence);
        }
    }
}
