package com.questrail.harness.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * FakeMessageBus
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageBus} that delivers injected signals synchronously on
 * the injecting thread. Calls are recorded and answered with {@code null}.
 */
public final class FakeMessageBus implements MessageBus {

    public record Call(String path, String interfaceName, String method, List<Object> args) {}

    private final List<Handler> handlers = new CopyOnWriteArrayList<>();
    private final List<Call> calls = new ArrayList<>();

    @Override
    public Subscription subscribe(String interfaceName, String member, String path, Consumer<BusSignal> handler) {
        Handler h = new Handler(interfaceName, member, path, Objects.requireNonNull(handler, "handler"));
        handlers.add(h);
        return () -> handlers.remove(h);
    }

    @Override
    public synchronized Object call(String path, String interfaceName, String method, List<Object> args) {
        calls.add(new Call(path, interfaceName, method, args));
        return null;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Delivers {@code signal} to every matching handler. Serialized like a real bus.
     */
    public synchronized void inject(BusSignal signal) {
        for (Handler h : handlers) {
            if (h.matches(signal)) {
                h.handler.accept(signal);
            }
        }
    }

    public int subscriptionCount() {
        return handlers.size();
    }

    public synchronized List<Call> calls() {
        return new ArrayList<>(calls);
    }

    private record Handler(String interfaceName, String member, String path, Consumer<BusSignal> handler) {
        boolean matches(BusSignal signal) {
            return (interfaceName == null || interfaceName.equals(signal.interfaceName()))
                    && (member == null || member.equals(signal.member()))
                    && (path == null || path.equals(signal.path()));
        }
    }
}
