package com.questrail.harness.supervisor;

import com.questrail.harness.bus.BusCallException;
import com.questrail.harness.bus.MessageBus;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Precondition that the service can accept remote calls.
 */
@FunctionalInterface
public interface ReadinessProbe
{
    /**
     * Waits until the service is ready or {@code timeout} elapses.
     *
     * @return {@code true} if ready in time
     */
    boolean awaitReady(ServiceHandle service, Duration timeout) throws InterruptedException;

    /**
     * Ready as soon as the process was launched.
     */
    static ReadinessProbe none()
    {
        return (service, timeout) -> true;
    }

    /**
     * Ready once the service printed its first line on stdout.
     */
    static ReadinessProbe firstOutputLine()
    {
        return (service, timeout) -> service.stdout().awaitFirstLine(timeout);
    }

    /**
     * Ready once a trivial remote call succeeds. Failed calls are retried every
     * {@code retryInterval} while the process is alive.
     *
     * <p>Each call runs on a helper thread and is abandoned, by interrupting
     * it, once the readiness timeout elapses; a service that accepts the call
     * but never replies is therefore reported as not ready.</p>
     */
    static ReadinessProbe remoteCall(MessageBus bus,
                                     String path,
                                     String interfaceName,
                                     String method,
                                     Duration retryInterval)
    {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(retryInterval, "retryInterval");
        return (service, timeout) -> {
            long end = System.nanoTime() + timeout.toNanos();
            ExecutorService caller = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "readiness-" + service.name());
                thread.setDaemon(true);
                return thread;
            });
            try {
                while (service.isAlive()) {
                    Future<Object> reply = caller.submit(() -> bus.call(path, interfaceName, method, List.of()));
                    try {
                        reply.get(Math.max(0L, end - System.nanoTime()), TimeUnit.NANOSECONDS);
                        return true;
                    } catch (TimeoutException e) {
                        reply.cancel(true);
                        return false;
                    } catch (InterruptedException e) {
                        reply.cancel(true);
                        throw e;
                    } catch (ExecutionException e) {
                        if (!(e.getCause() instanceof BusCallException)) {
                            throw new IllegalStateException("readiness call " + interfaceName + "." + method
                                    + " failed", e.getCause());
                        }
                    }
                    long remaining = end - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    TimeUnit.NANOSECONDS.sleep(Math.min(remaining, retryInterval.toNanos()));
                }
                return false;
            } finally {
                caller.shutdownNow();
            }
        };
    }
}
