package com.questrail.harness.process;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Attaches {@code gdb} in batch mode and dumps the stack of every thread.
 *
 * <p>Output goes to a temporary file rather than a pipe so that a chatty
 * debugger can never block on a full pipe buffer. The debugger is killed if it
 * has not finished within {@code timeout}.</p>
 */
public final class GdbStackTraceCollector implements StackTraceCollector {

    private final String gdbExecutable;
    private final Duration timeout;

    public GdbStackTraceCollector(Duration timeout) {
        this("gdb", timeout);
    }

    public GdbStackTraceCollector(String gdbExecutable, Duration timeout) {
        this.gdbExecutable = Objects.requireNonNull(gdbExecutable, "gdbExecutable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Optional<String> capture(long pid) {
        Path output = null;
        Process gdb = null;
        try {
            output = Files.createTempFile("stack-" + pid + "-", ".txt");
            gdb = new ProcessBuilder(List.of(
                    gdbExecutable, "-batch", "-nx",
                    "-p", Long.toString(pid),
                    "-ex", "thread apply all bt"))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .start();
            if (!gdb.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                gdb.destroyForcibly();
                return Optional.empty();
            }
            String trace = Files.readString(output, StandardCharsets.UTF_8).strip();
            return trace.isEmpty() ? Optional.empty() : Optional.of(trace);
        } catch (IOException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (gdb != null) {
                gdb.destroyForcibly();
            }
            return Optional.empty();
        } finally {
            if (output != null && !output.toFile().delete()) {
                output.toFile().deleteOnExit();
            }
        }
    }
}
