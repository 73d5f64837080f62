package com.questrail.harness.bus.loopback;

import com.questrail.harness.bus.BusCallException;
import com.questrail.harness.bus.BusMethod;
import com.questrail.harness.bus.BusSignal;
import com.questrail.harness.bus.BusTrafficLog;
import com.questrail.harness.bus.MessageBus;
import com.questrail.harness.bus.Subscription;
import com.questrail.harness.loop.CooperativeLoop;
import com.questrail.harness.observability.HarnessErrorEvent;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.time.SystemWallClock;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * LoopbackMessageBus
 * =============================================================================
 * In-process {@link MessageBus} that dispatches on the {@link CooperativeLoop}.
 *
 * <h2>Role</h2>
 * Stands in for the real session bus when the service under test is simulated
 * in-process, and serves as the bus for the harness's own tests. Emitters call
 * {@link #emit(BusSignal)}; service objects expose methods with
 * {@link #export(String, String, String, BusMethod)}.
 *
 * <h2>Ordering</h2>
 * Each {@link #emit} enqueues one loop task. Signals emitted from one thread are
 * therefore delivered in emission order, and handlers for one signal run in
 * registration order before the next signal is delivered.
 *
 * <p>All traffic is recorded in the supplied {@link BusTrafficLog}.</p>
 */
public final class LoopbackMessageBus implements MessageBus
{
    private final CooperativeLoop loop;
    private final BusTrafficLog traffic;
    private final HarnessObservabilitySink observabilitySink;

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Map<MethodKey, BusMethod> methods = new ConcurrentHashMap<>();

    public LoopbackMessageBus(CooperativeLoop loop, BusTrafficLog traffic, HarnessObservabilitySink observabilitySink)
    {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.traffic = Objects.requireNonNull(traffic, "traffic");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public Subscription subscribe(String interfaceName, String member, String path, Consumer<BusSignal> handler)
    {
        Registration registration = new Registration(interfaceName, member, path, Objects.requireNonNull(handler, "handler"));
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Broadcast a signal to every matching subscriber.
     */
    public void emit(BusSignal signal)
    {
        Objects.requireNonNull(signal, "signal");
        traffic.signal(signal);
        loop.execute(() -> dispatch(signal));
    }

    /**
     * Make a method callable through {@link #call}.
     *
     * @return handle that withdraws the method again
     */
    public Subscription export(String path, String interfaceName, String method, BusMethod implementation)
    {
        MethodKey key = new MethodKey(path, interfaceName, method);
        Objects.requireNonNull(implementation, "implementation");
        if (methods.putIfAbsent(key, implementation) != null) {
            throw new IllegalStateException("method already exported: " + key);
        }
        return () -> methods.remove(key, implementation);
    }

    @Override
    public Object call(String path, String interfaceName, String method, List<Object> args) throws InterruptedException
    {
        List<Object> arguments = args == null ? List.of() : args;
        traffic.call(path, interfaceName, method, arguments);

        BusMethod implementation = methods.get(new MethodKey(path, interfaceName, method));
        if (implementation == null) {
            BusCallException unknown = new BusCallException("UnknownMethod",
                    "no method " + interfaceName + "." + method + " at " + path);
            traffic.error(interfaceName, method, unknown);
            throw unknown;
        }

        CompletableFuture<Object> reply = new CompletableFuture<>();
        Runnable invocation = () -> {
            try {
                reply.complete(implementation.invoke(arguments));
            } catch (Exception e) {
                reply.completeExceptionally(e);
            }
        };
        if (loop.inLoop()) {
            invocation.run();
        } else {
            loop.execute(invocation);
        }

        try {
            Object result = reply.get();
            traffic.reply(interfaceName, method, result);
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            traffic.error(interfaceName, method, cause);
            if (cause instanceof BusCallException) {
                throw (BusCallException) cause;
            }
            throw new BusCallException("Failed", interfaceName + "." + method + " raised " + cause, cause);
        }
    }

    private void dispatch(BusSignal signal)
    {
        for (Registration registration : registrations) {
            if (!registration.matches(signal)) {
                continue;
            }
            try {
                registration.handler.accept(signal);
            } catch (RuntimeException | AssertionError e) {
                observabilitySink.onError(new HarnessErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Signal handler failed for " + signal.interfaceName() + "." + signal.member(),
                        e));
            }
        }
    }

    private record MethodKey(String path, String interfaceName, String method) {
        private MethodKey {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(interfaceName, "interfaceName");
            Objects.requireNonNull(method, "method");
        }
    }

    private static final class Registration {
        private final String interfaceName;
        private final String member;
        private final String path;
        private final Consumer<BusSignal> handler;

        private Registration(String interfaceName, String member, String path, Consumer<BusSignal> handler) {
            this.interfaceName = interfaceName;
            this.member = member;
            this.path = path;
            this.handler = handler;
        }

        private boolean matches(BusSignal signal) {
            return (interfaceName == null || interfaceName.equals(signal.interfaceName()))
                    && (member == null || member.equals(signal.member()))
                    && (path == null || path.equals(signal.path()));
        }
    }
}
