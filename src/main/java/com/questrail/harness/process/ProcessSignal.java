package com.questrail.harness.process;

/**
 * The two steps of the termination escalation.
 */
public enum ProcessSignal {
    /** Request to terminate (SIGTERM). */
    GRACEFUL("SIGTERM"),
    /** Kill without giving the process a choice (SIGKILL). */
    FORCEFUL("SIGKILL");

    private final String posixName;

    ProcessSignal(String posixName) {
        this.posixName = posixName;
    }

    public String posixName() {
        return posixName;
    }
}
