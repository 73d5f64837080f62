package com.questrail.harness.supervisor;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * A launched child process together with its captured output.
 * Used for both the service and auxiliary side processes.
 */
public final class ServiceHandle {

    private final String name;
    private final Process process;
    private final OutputCapture stdout;
    private final OutputCapture stderr;

    ServiceHandle(String name, Process process, OutputCapture stdout, OutputCapture stderr) {
        this.name = Objects.requireNonNull(name, "name");
        this.process = Objects.requireNonNull(process, "process");
        this.stdout = Objects.requireNonNull(stdout, "stdout");
        this.stderr = Objects.requireNonNull(stderr, "stderr");
    }

    public String name() {
        return name;
    }

    /**
     * @return pid of the launched process; may be a wrapper around the real service
     */
    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public OutputCapture stdout() {
        return stdout;
    }

    public OutputCapture stderr() {
        return stderr;
    }

    /**
     * @return exit code if the process has exited; on Unix, death by signal N
     *         reads as 128 + N
     */
    public OptionalInt exitCode() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    /**
     * Waits for the process to exit.
     *
     * @return the exit code, or empty if still running after {@code timeout}
     */
    public OptionalInt awaitExit(Duration timeout) throws InterruptedException {
        if (process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return OptionalInt.of(process.exitValue());
        }
        return OptionalInt.empty();
    }

    /**
     * Closes stdin, which some services treat as a request to quit.
     */
    public void closeInput() throws IOException {
        process.getOutputStream().close();
    }
}
