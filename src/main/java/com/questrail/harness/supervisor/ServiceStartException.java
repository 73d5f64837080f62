package com.questrail.harness.supervisor;

/**
 * Raised when the service cannot be launched or does not become ready in time.
 */
public class ServiceStartException extends RuntimeException {

    public ServiceStartException(String message) {
        super(message);
    }

    public ServiceStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
