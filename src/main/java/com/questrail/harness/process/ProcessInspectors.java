package com.questrail.harness.process;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picks the {@link ProcessInspector} for the running platform.
 */
public final class ProcessInspectors {

    private ProcessInspectors() {}

    public static ProcessInspector forCurrentPlatform() {
        if (Files.isReadable(Path.of("/proc/self/stat"))) {
            return new ProcfsProcessInspector();
        }
        return new ProcessHandleInspector();
    }
}
