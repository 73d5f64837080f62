package com.questrail.harness.bus;

/**
 * Handle for a registered signal handler or exported method.
 */
public interface Subscription
{
    /**
     * Unregisters the handler. Idempotent.
     */
    void remove();
}
