package com.questrail.harness.supervisor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What to launch as the service under test.
 *
 * @param args                command and arguments, without the launcher prefix
 * @param environment         variables added to (or overriding) the inherited environment
 * @param workingDirectory    working directory, {@code null} to inherit
 * @param executableSignature executable name of the real service, used to find it
 *                            below a wrapper script; {@code null} if the launched
 *                            process is the service
 * @param readiness           precondition awaited after launch
 */
public record ServiceCommand(
    List<String> args,
    Map<String, String> environment,
    Path workingDirectory,
    String executableSignature,
    ReadinessProbe readiness
) {
    public ServiceCommand {
        args = List.copyOf(Objects.requireNonNull(args, "args"));
        if (args.isEmpty()) {
            throw new IllegalArgumentException("args must not be empty");
        }
        environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        readiness = Objects.requireNonNullElse(readiness, ReadinessProbe.none());
    }

    public static ServiceCommand of(String... args) {
        return new ServiceCommand(List.of(args), Map.of(), null, null, ReadinessProbe.none());
    }

    public ServiceCommand withEnvironment(String name, String value) {
        Map<String, String> env = new LinkedHashMap<>(environment);
        env.put(name, value);
        return new ServiceCommand(args, env, workingDirectory, executableSignature, readiness);
    }

    public ServiceCommand withWorkingDirectory(Path directory) {
        return new ServiceCommand(args, environment, directory, executableSignature, readiness);
    }

    public ServiceCommand withExecutableSignature(String signature) {
        return new ServiceCommand(args, environment, workingDirectory, signature, readiness);
    }

    public ServiceCommand withReadiness(ReadinessProbe probe) {
        return new ServiceCommand(args, environment, workingDirectory, executableSignature, probe);
    }

    /**
     * @return the executable name used in logs and thread names
     */
    public String displayName() {
        String first = args.get(0);
        int slash = first.lastIndexOf('/');
        return slash < 0 ? first : first.substring(slash + 1);
    }
}
