package com.questrail.harness.process;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Linux {@link ProcessInspector} reading {@code /proc/<pid>/stat} and
 * {@code /proc/<pid>/cmdline}.
 *
 * <p>Zombie ({@code Z}) and dead ({@code X}) entries are reported as absent:
 * a reparented zombie is reaped by init, never by us.</p>
 */
public final class ProcfsProcessInspector implements ProcessInspector {

    private final Path procRoot;

    public ProcfsProcessInspector() {
        this(Path.of("/proc"));
    }

    public ProcfsProcessInspector(Path procRoot) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
    }

    @Override
    public List<ProcessRecord> snapshot() {
        List<ProcessRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(procRoot)) {
            for (Path entry : entries) {
                long pid = parsePid(entry.getFileName().toString());
                if (pid > 0) {
                    read(pid).ifPresent(records::add);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + procRoot, e);
        }
        return records;
    }

    @Override
    public Optional<ProcessRecord> find(long pid) {
        return read(pid);
    }

    private Optional<ProcessRecord> read(long pid) {
        Path dir = procRoot.resolve(Long.toString(pid));
        String stat;
        byte[] cmdline;
        try {
            stat = Files.readString(dir.resolve("stat"), StandardCharsets.UTF_8);
            cmdline = Files.readAllBytes(dir.resolve("cmdline"));
        } catch (IOException e) {
            // Exited between listing and reading.
            return Optional.empty();
        }
        return parse(pid, stat, cmdline);
    }

    /**
     * Parses one {@code stat} line plus the raw {@code cmdline} bytes.
     *
     * <p>The command name in field 2 is parenthesised and may itself contain
     * spaces and parentheses, so fields are located from the last {@code ')'}.</p>
     */
    static Optional<ProcessRecord> parse(long pid, String stat, byte[] cmdline) {
        int open = stat.indexOf('(');
        int close = stat.lastIndexOf(')');
        if (open < 0 || close < open) {
            return Optional.empty();
        }
        String comm = stat.substring(open + 1, close);
        String[] fields = stat.substring(close + 1).trim().split("\\s+");
        if (fields.length < 3) {
            return Optional.empty();
        }

        char state = fields[0].isEmpty() ? '?' : fields[0].charAt(0);
        if (state == 'Z' || state == 'X') {
            return Optional.empty();
        }

        long parentPid;
        long groupId;
        try {
            parentPid = Long.parseLong(fields[1]);
            groupId = Long.parseLong(fields[2]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String commandLine = decodeCmdline(cmdline);
        if (commandLine.isEmpty()) {
            commandLine = "[" + comm + "]";
        }
        return Optional.of(new ProcessRecord(pid, parentPid, groupId, commandLine));
    }

    private static String decodeCmdline(byte[] raw) {
        String joined = new String(raw, StandardCharsets.UTF_8).replace('\0', ' ');
        return joined.strip();
    }

    private static long parsePid(String name) {
        if (name.isEmpty()) {
            return -1L;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return -1L;
            }
        }
        try {
            return Long.parseLong(name);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
