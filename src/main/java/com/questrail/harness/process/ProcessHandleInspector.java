package com.questrail.harness.process;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Portable {@link ProcessInspector} over {@link ProcessHandle}.
 *
 * <p>The JDK does not expose process groups, so every record carries
 * {@link ProcessRecord#UNKNOWN_GROUP}; discovery then relies on parent links
 * alone.</p>
 */
public final class ProcessHandleInspector implements ProcessInspector {

    @Override
    public List<ProcessRecord> snapshot() {
        return ProcessHandle.allProcesses()
                .map(ProcessHandleInspector::toRecord)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ProcessRecord> find(long pid) {
        return ProcessHandle.of(pid).flatMap(ProcessHandleInspector::toRecord);
    }

    private static Optional<ProcessRecord> toRecord(ProcessHandle handle) {
        if (handle.pid() <= 0 || !handle.isAlive()) {
            return Optional.empty();
        }
        long parent = handle.parent().map(ProcessHandle::pid).orElse(0L);
        ProcessHandle.Info info = handle.info();
        String commandLine = info.commandLine().orElseGet(() -> info.command().orElse(""));
        return Optional.of(new ProcessRecord(handle.pid(), parent, ProcessRecord.UNKNOWN_GROUP, commandLine));
    }
}
