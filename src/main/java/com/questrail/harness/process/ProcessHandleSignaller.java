package com.questrail.harness.process;

import java.util.Optional;

/**
 * {@link ProcessSignaller} over {@link ProcessHandle#destroy()} (SIGTERM) and
 * {@link ProcessHandle#destroyForcibly()} (SIGKILL).
 *
 * <p>{@code ProcessHandle} also checks the process start time, so a pid that was
 * recycled after the original process exited is not signalled.</p>
 */
public final class ProcessHandleSignaller implements ProcessSignaller {

    private final long selfPid = ProcessHandle.current().pid();

    @Override
    public boolean send(long pid, ProcessSignal signal) {
        if (pid == selfPid) {
            throw new IllegalArgumentException("refusing to signal the harness itself");
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return false;
        }
        return signal == ProcessSignal.GRACEFUL
                ? handle.get().destroy()
                : handle.get().destroyForcibly();
    }
}
