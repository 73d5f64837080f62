package com.questrail.harness.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A broadcast notification as delivered by the messaging bus.
 *
 * @param interfaceName emitting interface, e.g. {@code org.syncevolution.Session}
 * @param member        signal name, e.g. {@code StatusChanged}
 * @param path          object path of the emitter
 * @param args          positional arguments; may contain {@code null}
 */
public record BusSignal(
    String interfaceName,
    String member,
    String path,
    List<Object> args
) {
    public BusSignal {
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(path, "path");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static BusSignal of(String interfaceName, String member, String path, Object... args) {
        List<Object> list = new ArrayList<>(args.length);
        Collections.addAll(list, args);
        return new BusSignal(interfaceName, member, path, list);
    }
}
