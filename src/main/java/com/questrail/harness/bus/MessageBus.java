package com.questrail.harness.bus;

import java.util.List;
import java.util.function.Consumer;

/**
 * MessageBus
 * =============================================================================
 * Capability port for the inter-process messaging bus the service under test
 * talks on. The harness only needs publish/subscribe and remote calls; the
 * wire protocol belongs to the concrete implementation.
 *
 * <h2>Delivery contract</h2>
 * <ul>
 *   <li>Handlers are invoked in a serialized manner, in bus-delivery order.</li>
 *   <li>A handler must not block; it may only record and hand off.</li>
 * </ul>
 */
public interface MessageBus
{
    /**
     * Register a signal handler.
     *
     * @param interfaceName interface filter, {@code null} for any
     * @param member        signal name filter, {@code null} for any
     * @param path          object path filter, {@code null} for any
     * @param handler       callback invoked for each matching signal
     * @return handle whose {@link Subscription#remove()} unregisters the handler
     */
    Subscription subscribe(String interfaceName, String member, String path, Consumer<BusSignal> handler);

    /**
     * Invoke a remote method and wait for its reply without a time limit.
     * The wait ends early only through interruption.
     *
     * @return the method's reply, possibly {@code null}
     * @throws BusCallException     if the call failed on the remote side
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    Object call(String path, String interfaceName, String method, List<Object> args) throws InterruptedException;
}
