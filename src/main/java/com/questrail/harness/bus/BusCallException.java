package com.questrail.harness.bus;

/**
 * Raised when a remote call fails: unknown method, or the method itself threw.
 */
public class BusCallException extends RuntimeException {

    private final String errorName;

    public BusCallException(String errorName, String message) {
        super(errorName + ": " + message);
        this.errorName = errorName;
    }

    public BusCallException(String errorName, String message, Throwable cause) {
        super(errorName + ": " + message, cause);
        this.errorName = errorName;
    }

    /**
     * @return bus-level error name, e.g. {@code UnknownMethod}
     */
    public String errorName() {
        return errorName;
    }
}
