package com.questrail.harness.process;

import java.util.List;
import java.util.Optional;

/**
 * ProcessInspector
 * =============================================================================
 * Read-only view of the host process table, limited to what the current user
 * may see.
 *
 * <h2>Vanishing processes</h2>
 * Processes come and go while a snapshot is being taken. Implementations skip
 * entries that disappear mid-read instead of failing, and report a process
 * that is a zombie as no longer existing.
 */
public interface ProcessInspector
{
    /**
     * @return all visible processes at (roughly) one point in time
     */
    List<ProcessRecord> snapshot();

    /**
     * @return the current record of {@code pid}, or empty if it no longer exists
     */
    Optional<ProcessRecord> find(long pid);

    /**
     * Non-blocking existence probe.
     */
    default boolean exists(long pid)
    {
        return find(pid).isPresent();
    }
}
