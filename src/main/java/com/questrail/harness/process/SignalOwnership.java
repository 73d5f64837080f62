package com.questrail.harness.process;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of pids currently being shut down. A pid can be claimed by one
 * termination run at a time, so concurrent scenarios whose process groups
 * overlap never signal the same process twice.
 */
public final class SignalOwnership {

    private static final SignalOwnership PROCESS_WIDE = new SignalOwnership();

    private final Set<Long> claimed = ConcurrentHashMap.newKeySet();

    /**
     * @return the registry shared by every termination protocol in this JVM
     */
    public static SignalOwnership processWide() {
        return PROCESS_WIDE;
    }

    public boolean claim(long pid) {
        return claimed.add(pid);
    }

    public void release(long pid) {
        claimed.remove(pid);
    }

    public boolean isClaimed(long pid) {
        return claimed.contains(pid);
    }
}
