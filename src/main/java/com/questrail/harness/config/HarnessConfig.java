package com.questrail.harness.config;

import com.questrail.harness.process.TerminationTiming;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the harness runtime.
 *
 * <h2>Properties</h2>
 * {@link #fromProperties(Properties)} reads the keys below; absent keys keep
 * their {@link #defaults()} value. Durations accept ISO-8601 ({@code PT2.5S}) or
 * a plain number of seconds ({@code 2.5}).
 * <ul>
 *   <li>{@code harness.scenarioTimeout}</li>
 *   <li>{@code harness.shutdownGracePeriod}</li>
 *   <li>{@code harness.auxiliaryGracePeriod}</li>
 *   <li>{@code harness.readinessTimeout}</li>
 *   <li>{@code harness.pollInterval}, {@code harness.killRetryInterval}, {@code harness.killTimeout}</li>
 *   <li>{@code harness.launcherPrefix}: space-separated, empty for none</li>
 *   <li>{@code harness.outputTailLines}, {@code harness.busTrafficLines}</li>
 *   <li>{@code harness.captureStackTraces}, {@code harness.stackTraceTimeout}</li>
 * </ul>
 */
public record HarnessConfig(
    Duration scenarioTimeout,
    Duration shutdownGracePeriod,
    Duration auxiliaryGracePeriod,
    Duration readinessTimeout,
    TerminationTiming terminationTiming,
    List<String> launcherPrefix,
    int outputTailLines,
    int busTrafficLines,
    boolean captureStackTraces,
    Duration stackTraceTimeout
) {
    public static final String PREFIX = "harness.";

    public HarnessConfig {
        Objects.requireNonNull(scenarioTimeout, "scenarioTimeout");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");
        Objects.requireNonNull(auxiliaryGracePeriod, "auxiliaryGracePeriod");
        Objects.requireNonNull(readinessTimeout, "readinessTimeout");
        Objects.requireNonNull(terminationTiming, "terminationTiming");
        Objects.requireNonNull(stackTraceTimeout, "stackTraceTimeout");
        launcherPrefix = List.copyOf(Objects.requireNonNull(launcherPrefix, "launcherPrefix"));

        if (scenarioTimeout.isNegative() || scenarioTimeout.isZero()) {
            throw new IllegalArgumentException("scenarioTimeout must be positive");
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must be non-negative");
        }
        if (auxiliaryGracePeriod.isNegative()) {
            throw new IllegalArgumentException("auxiliaryGracePeriod must be non-negative");
        }
        if (readinessTimeout.isNegative()) {
            throw new IllegalArgumentException("readinessTimeout must be non-negative");
        }
        if (outputTailLines <= 0) {
            throw new IllegalArgumentException("outputTailLines must be positive");
        }
        if (busTrafficLines <= 0) {
            throw new IllegalArgumentException("busTrafficLines must be positive");
        }
    }

    /**
     * Defaults:
     * <ul>
     *   <li>scenarioTimeout: 120s</li>
     *   <li>shutdownGracePeriod: 20s</li>
     *   <li>auxiliaryGracePeriod: 5s</li>
     *   <li>readinessTimeout: 30s</li>
     *   <li>terminationTiming: {@link TerminationTiming#defaults()}</li>
     *   <li>launcherPrefix: {@code setsid} when installed, otherwise none</li>
     *   <li>outputTailLines: 2000, busTrafficLines: 5000</li>
     *   <li>captureStackTraces: false, stackTraceTimeout: 10s</li>
     * </ul>
     */
    public static HarnessConfig defaults() {
        return builder().build();
    }

    public static HarnessConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static HarnessConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        HarnessConfig d = defaults();
        TerminationTiming t = d.terminationTiming();

        return new HarnessConfig(
                duration(properties, "scenarioTimeout", d.scenarioTimeout()),
                duration(properties, "shutdownGracePeriod", d.shutdownGracePeriod()),
                duration(properties, "auxiliaryGracePeriod", d.auxiliaryGracePeriod()),
                duration(properties, "readinessTimeout", d.readinessTimeout()),
                new TerminationTiming(
                        duration(properties, "pollInterval", t.pollInterval()),
                        duration(properties, "killRetryInterval", t.killRetryInterval()),
                        duration(properties, "killTimeout", t.killTimeout())),
                words(properties, "launcherPrefix", d.launcherPrefix()),
                integer(properties, "outputTailLines", d.outputTailLines()),
                integer(properties, "busTrafficLines", d.busTrafficLines()),
                bool(properties, "captureStackTraces", d.captureStackTraces()),
                duration(properties, "stackTraceTimeout", d.stackTraceTimeout())
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withScenarioTimeout(scenarioTimeout)
                .withShutdownGracePeriod(shutdownGracePeriod)
                .withAuxiliaryGracePeriod(auxiliaryGracePeriod)
                .withReadinessTimeout(readinessTimeout)
                .withTerminationTiming(terminationTiming)
                .withLauncherPrefix(launcherPrefix)
                .withOutputTailLines(outputTailLines)
                .withBusTrafficLines(busTrafficLines)
                .withCaptureStackTraces(captureStackTraces)
                .withStackTraceTimeout(stackTraceTimeout);
    }

    static Duration parseDuration(String key, String raw) {
        String value = raw.trim();
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            BigDecimal seconds = new BigDecimal(value);
            return Duration.ofNanos(seconds.movePointRight(9).longValueExact());
        } catch (DateTimeParseException | ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("invalid duration for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static Duration duration(Properties properties, String key, Duration fallback) {
        String raw = properties.getProperty(PREFIX + key);
        return raw == null ? fallback : parseDuration(key, raw);
    }

    private static int integer(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static boolean bool(Properties properties, String key, boolean fallback) {
        String raw = properties.getProperty(PREFIX + key);
        return raw == null ? fallback : Boolean.parseBoolean(raw.trim());
    }

    private static List<String> words(Properties properties, String key, List<String> fallback) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null) {
            return fallback;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }

    private static List<String> detectLauncherPrefix() {
        for (String dir : List.of("/usr/bin", "/bin")) {
            if (Files.isExecutable(Path.of(dir, "setsid"))) {
                return List.of(dir + "/setsid");
            }
        }
        return List.of();
    }

    public static final class Builder {
        private Duration scenarioTimeout = Duration.ofSeconds(120);
        private Duration shutdownGracePeriod = Duration.ofSeconds(20);
        private Duration auxiliaryGracePeriod = Duration.ofSeconds(5);
        private Duration readinessTimeout = Duration.ofSeconds(30);
        private TerminationTiming terminationTiming = TerminationTiming.defaults();
        private List<String> launcherPrefix = detectLauncherPrefix();
        private int outputTailLines = 2000;
        private int busTrafficLines = 5000;
        private boolean captureStackTraces = false;
        private Duration stackTraceTimeout = Duration.ofSeconds(10);

        public Builder withScenarioTimeout(Duration scenarioTimeout) {
            this.scenarioTimeout = scenarioTimeout;
            return this;
        }

        public Builder withShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        public Builder withAuxiliaryGracePeriod(Duration auxiliaryGracePeriod) {
            this.auxiliaryGracePeriod = auxiliaryGracePeriod;
            return this;
        }

        public Builder withReadinessTimeout(Duration readinessTimeout) {
            this.readinessTimeout = readinessTimeout;
            return this;
        }

        public Builder withTerminationTiming(TerminationTiming terminationTiming) {
            this.terminationTiming = terminationTiming;
            return this;
        }

        public Builder withLauncherPrefix(List<String> launcherPrefix) {
            this.launcherPrefix = launcherPrefix;
            return this;
        }

        public Builder withOutputTailLines(int outputTailLines) {
            this.outputTailLines = outputTailLines;
            return this;
        }

        public Builder withBusTrafficLines(int busTrafficLines) {
            this.busTrafficLines = busTrafficLines;
            return this;
        }

        public Builder withCaptureStackTraces(boolean captureStackTraces) {
            this.captureStackTraces = captureStackTraces;
            return this;
        }

        public Builder withStackTraceTimeout(Duration stackTraceTimeout) {
            this.stackTraceTimeout = stackTraceTimeout;
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(
                    scenarioTimeout,
                    shutdownGracePeriod,
                    auxiliaryGracePeriod,
                    readinessTimeout,
                    terminationTiming,
                    launcherPrefix,
                    outputTailLines,
                    busTrafficLines,
                    captureStackTraces,
                    stackTraceTimeout);
        }
    }
}
