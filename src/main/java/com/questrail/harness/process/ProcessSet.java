package com.questrail.harness.process;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Processes transitively owned by a root, as computed by
 * {@link ProcessTree#discover(long, Set)}. Immutable.
 *
 * <p>Iteration order is discovery order: the root first (when it still
 * existed), then breadth-first descendants.</p>
 */
public final class ProcessSet {

    private final long rootPid;
    private final Set<Long> trackedGroups;
    private final Map<Long, ProcessRecord> members;

    ProcessSet(long rootPid, Set<Long> trackedGroups, Collection<ProcessRecord> members) {
        this.rootPid = rootPid;
        this.trackedGroups = Collections.unmodifiableSet(new LinkedHashSet<>(trackedGroups));
        Map<Long, ProcessRecord> copy = new LinkedHashMap<>();
        for (ProcessRecord record : members) {
            copy.putIfAbsent(record.pid(), record);
        }
        this.members = Collections.unmodifiableMap(copy);
    }

    public static ProcessSet of(long rootPid, Collection<ProcessRecord> members) {
        return new ProcessSet(rootPid, Set.of(), members);
    }

    public long rootPid() {
        return rootPid;
    }

    public Set<Long> trackedGroups() {
        return trackedGroups;
    }

    public boolean contains(long pid) {
        return members.containsKey(pid);
    }

    public Set<Long> pids() {
        return members.keySet();
    }

    public Collection<ProcessRecord> records() {
        return members.values();
    }

    public Optional<ProcessRecord> record(long pid) {
        return Optional.ofNullable(members.get(pid));
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * @return a copy with {@code extra} added unless a record for its pid exists
     */
    public ProcessSet with(ProcessRecord extra) {
        if (members.containsKey(extra.pid())) {
            return this;
        }
        Map<Long, ProcessRecord> copy = new LinkedHashMap<>(members);
        copy.put(extra.pid(), extra);
        return new ProcessSet(rootPid, trackedGroups, copy.values());
    }

    @Override
    public String toString() {
        return "ProcessSet{root=" + rootPid + ", groups=" + trackedGroups + ", pids=" + members.keySet() + '}';
    }
}
