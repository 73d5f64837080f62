package com.questrail.harness.process;

import java.util.Objects;

/**
 * One row of a process-table snapshot. Only valid at capture time: the process
 * may have exited or been reparented since.
 *
 * @param processGroupId group id, or {@link #UNKNOWN_GROUP} where the platform
 *                       does not expose it
 */
public record ProcessRecord(
    long pid,
    long parentPid,
    long processGroupId,
    String commandLine
) {
    public static final long UNKNOWN_GROUP = -1L;

    public ProcessRecord {
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be positive: " + pid);
        }
        Objects.requireNonNull(commandLine, "commandLine");
    }

    /**
     * @return the first word of the command line without its directory
     */
    public String executableName() {
        String trimmed = commandLine.strip();
        int space = trimmed.indexOf(' ');
        String executable = space < 0 ? trimmed : trimmed.substring(0, space);
        int slash = executable.lastIndexOf('/');
        return slash < 0 ? executable : executable.substring(slash + 1);
    }
}
