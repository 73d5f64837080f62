package com.questrail.harness.process;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessHandleInspectorTest {

    private final ProcessHandleInspector inspector = new ProcessHandleInspector();

    @Test
    void findsTheCurrentProcess() {
        long self = ProcessHandle.current().pid();

        ProcessRecord record = inspector.find(self).orElseThrow();

        assertEquals(self, record.pid());
        assertEquals(ProcessRecord.UNKNOWN_GROUP, record.processGroupId());
        assertTrue(inspector.snapshot().stream().anyMatch(r -> r.pid() == self));
    }

    @Test
    void exitedChildIsNoLongerFound() throws Exception {
        Process child = new ProcessBuilder(Path.of(System.getProperty("java.home"), "bin", "java").toString(), "-version")
                .redirectErrorStream(true)
                .start();
        long pid = child.pid();
        child.getInputStream().readAllBytes();
        assertTrue(child.waitFor(30, TimeUnit.SECONDS));

        assertFalse(inspector.exists(pid));
    }
}
