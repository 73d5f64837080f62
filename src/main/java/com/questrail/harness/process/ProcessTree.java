package com.questrail.harness.process;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ProcessTree
 * =============================================================================
 * Discovers a process and everything it owns from one process-table snapshot.
 *
 * <h2>Membership</h2>
 * A record belongs to the set of {@code root} iff
 * <ul>
 *   <li>it is the root, or its parent is the root, or</li>
 *   <li>its group id is one of the tracked groups, or</li>
 *   <li>its parent transitively belongs.</li>
 * </ul>
 * Group membership catches descendants that were reparented to init after
 * their parent died. Excluded pids never belong, and nothing is discovered
 * through them: they are managed separately.
 *
 * <p>The harness's own pid is always excluded. Discovery is read-only.</p>
 */
public final class ProcessTree {

    private final ProcessInspector inspector;
    private final Set<Long> excludedPids;

    public ProcessTree(ProcessInspector inspector) {
        this(inspector, Set.of());
    }

    public ProcessTree(ProcessInspector inspector, Collection<Long> excludedPids) {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        Set<Long> excluded = new LinkedHashSet<>(excludedPids);
        excluded.add(ProcessHandle.current().pid());
        this.excludedPids = Set.copyOf(excluded);
    }

    /**
     * @return a tree that additionally excludes {@code more}
     */
    public ProcessTree excluding(Collection<Long> more) {
        Set<Long> combined = new LinkedHashSet<>(excludedPids);
        combined.addAll(more);
        return new ProcessTree(inspector, combined);
    }

    public Set<Long> excludedPids() {
        return excludedPids;
    }

    public ProcessInspector inspector() {
        return inspector;
    }

    public ProcessSet discover(long rootPid) {
        return discover(rootPid, Set.of());
    }

    public ProcessSet discover(long rootPid, Set<Long> extraGroupIds) {
        return closure(rootPid, extraGroupIds, inspector.snapshot(), excludedPids);
    }

    /**
     * Pure membership computation over a snapshot.
     */
    static ProcessSet closure(long rootPid,
                              Set<Long> trackedGroups,
                              Collection<ProcessRecord> snapshot,
                              Set<Long> excludedPids)
    {
        Map<Long, ProcessRecord> byPid = new HashMap<>();
        Map<Long, List<ProcessRecord>> childrenByParent = new HashMap<>();
        for (ProcessRecord record : snapshot) {
            byPid.put(record.pid(), record);
            childrenByParent.computeIfAbsent(record.parentPid(), k -> new ArrayList<>()).add(record);
        }

        Map<Long, ProcessRecord> members = new LinkedHashMap<>();
        Deque<Long> frontier = new ArrayDeque<>();

        if (!excludedPids.contains(rootPid)) {
            ProcessRecord root = byPid.get(rootPid);
            if (root != null) {
                members.put(rootPid, root);
            }
            // Walk from the root pid even if it has already exited.
            frontier.add(rootPid);
        }

        if (!trackedGroups.isEmpty()) {
            for (ProcessRecord record : snapshot) {
                if (trackedGroups.contains(record.processGroupId())
                        && !excludedPids.contains(record.pid())
                        && members.putIfAbsent(record.pid(), record) == null) {
                    frontier.add(record.pid());
                }
            }
        }

        while (!frontier.isEmpty()) {
            long parent = frontier.poll();
            for (ProcessRecord child : childrenByParent.getOrDefault(parent, List.of())) {
                if (excludedPids.contains(child.pid())) {
                    continue;
                }
                if (members.putIfAbsent(child.pid(), child) == null) {
                    frontier.add(child.pid());
                }
            }
        }

        return new ProcessSet(rootPid, trackedGroups, members.values());
    }
}
