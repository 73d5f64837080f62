package com.questrail.harness.bus;

import com.questrail.harness.time.WallClock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, thread-safe record of bus traffic, attached to failed scenario
 * reports. Oldest lines are dropped once {@code maxLines} is reached.
 */
public final class BusTrafficLog {

    private final WallClock wallClock;
    private final int maxLines;
    private final Deque<String> lines = new ArrayDeque<>();
    private long dropped;

    public BusTrafficLog(WallClock wallClock, int maxLines) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive");
        }
        this.maxLines = maxLines;
    }

    public void signal(BusSignal signal) {
        append("signal " + signal.interfaceName() + "." + signal.member()
                + " path=" + signal.path() + " args=" + signal.args());
    }

    public void call(String path, String interfaceName, String method, List<Object> args) {
        append("call " + interfaceName + "." + method + " path=" + path + " args=" + args);
    }

    public void reply(String interfaceName, String method, Object reply) {
        append("reply " + interfaceName + "." + method + " -> " + reply);
    }

    public void error(String interfaceName, String method, Throwable error) {
        append("error " + interfaceName + "." + method + " -> " + error);
    }

    public synchronized List<String> lines() {
        return new ArrayList<>(lines);
    }

    /**
     * Renders the log as one line per entry, noting how many lines were dropped.
     */
    public synchronized String render() {
        StringBuilder sb = new StringBuilder();
        if (dropped > 0) {
            sb.append("... ").append(dropped).append(" earlier lines dropped\n");
        }
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private synchronized void append(String line) {
        if (lines.size() == maxLines) {
            lines.removeFirst();
            dropped++;
        }
        lines.addLast(wallClock.now() + " " + line);
    }
}
