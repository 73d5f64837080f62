package com.questrail.harness.supervisor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * OutputCapture
 * =============================================================================
 * Pumps one output stream of a child process, line by line, into a bounded
 * in-memory tail.
 *
 * <p>The pump runs on a daemon thread so that a child writing a lot can never
 * stall on a full pipe. The first line (or end of stream) releases
 * {@link #awaitFirstLine(Duration)}.</p>
 */
public final class OutputCapture {

    private final String name;
    private final int maxLines;
    private final Consumer<IOException> failureHandler;

    private final Deque<String> tail = new ArrayDeque<>();
    private final CountDownLatch firstLine = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private long totalLines;
    private volatile Thread pump;

    public OutputCapture(String name, int maxLines, Consumer<IOException> failureHandler) {
        this.name = Objects.requireNonNull(name, "name");
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive");
        }
        this.maxLines = maxLines;
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public String name() {
        return name;
    }

    /**
     * Starts pumping {@code stream}. May be called once.
     */
    public void pump(InputStream stream) {
        Objects.requireNonNull(stream, "stream");
        if (pump != null) {
            throw new IllegalStateException("already pumping " + name);
        }
        Thread t = new Thread(() -> drain(stream), "output-" + name);
        t.setDaemon(true);
        pump = t;
        t.start();
    }

    /**
     * @return {@code true} if a line arrived within {@code timeout}; {@code false}
     *         on timeout or when the stream ended without output
     */
    public boolean awaitFirstLine(Duration timeout) throws InterruptedException {
        firstLine.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        synchronized (this) {
            return totalLines > 0;
        }
    }

    /**
     * Waits for the stream to reach end of file.
     *
     * @return {@code true} if the stream closed within {@code timeout}
     */
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public synchronized List<String> lines() {
        return new ArrayList<>(tail);
    }

    public synchronized long totalLines() {
        return totalLines;
    }

    /**
     * Renders the captured tail, noting dropped lines.
     */
    public synchronized String render() {
        StringBuilder sb = new StringBuilder();
        long dropped = totalLines - tail.size();
        if (dropped > 0) {
            sb.append("... ").append(dropped).append(" earlier lines dropped\n");
        }
        for (String line : tail) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private void drain(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                append(line);
            }
        } catch (IOException e) {
            failureHandler.accept(e);
        } finally {
            firstLine.countDown();
            closed.countDown();
        }
    }

    private synchronized void append(String line) {
        if (tail.size() == maxLines) {
            tail.removeFirst();
        }
        tail.addLast(line);
        totalLines++;
        firstLine.countDown();
    }
}
