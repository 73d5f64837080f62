package com.questrail.harness.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProcfsProcessInspectorTest {

    @Test
    void parsesFieldsAfterTheCommandName() {
        String stat = "4242 (my (odd) name) S 17 4242 4242 0 -1 4194560 100 0 0 0";
        byte[] cmdline = "/usr/libexec/syncevo-dbus-server\0--verbose\0".getBytes(StandardCharsets.UTF_8);

        ProcessRecord record = ProcfsProcessInspector.parse(4242, stat, cmdline).orElseThrow();

        assertEquals(4242, record.pid());
        assertEquals(17, record.parentPid());
        assertEquals(4242, record.processGroupId());
        assertEquals("/usr/libexec/syncevo-dbus-server --verbose", record.commandLine());
        assertEquals("syncevo-dbus-server", record.executableName());
    }

    @Test
    void zombiesAreReportedAsGone() {
        String stat = "77 (defunct) Z 1 77 77 0";
        assertEquals(Optional.empty(), ProcfsProcessInspector.parse(77, stat, new byte[0]));
    }

    @Test
    void kernelThreadsUseTheCommandName() {
        String stat = "2 (kthreadd) S 0 0 0 0";
        ProcessRecord record = ProcfsProcessInspector.parse(2, stat, new byte[0]).orElseThrow();
        assertEquals("[kthreadd]", record.commandLine());
    }

    @Test
    void garbageIsIgnored() {
        assertTrue(ProcfsProcessInspector.parse(5, "nonsense", new byte[0]).isEmpty());
        assertTrue(ProcfsProcessInspector.parse(5, "5 (x) S notanumber 5", new byte[0]).isEmpty());
    }

    @Test
    void snapshotReadsEveryNumericDirectory(@TempDir Path proc) throws Exception {
        writeProc(proc, 10, "10 (init) S 0 10 10", "init");
        writeProc(proc, 11, "11 (sh) S 10 11 11", "sh\0-c\0true");
        Files.createDirectories(proc.resolve("self"));
        Files.createDirectories(proc.resolve("12"));

        List<ProcessRecord> records = new ProcfsProcessInspector(proc).snapshot();

        assertEquals(2, records.size());
        assertTrue(new ProcfsProcessInspector(proc).exists(11));
        assertFalse(new ProcfsProcessInspector(proc).exists(12));
    }

    private static void writeProc(Path proc, long pid, String stat, String cmdline) throws Exception {
        Path dir = Files.createDirectories(proc.resolve(Long.toString(pid)));
        Files.writeString(dir.resolve("stat"), stat);
        Files.write(dir.resolve("cmdline"), cmdline.getBytes(StandardCharsets.UTF_8));
    }
}
