package dev.macros.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs shared by the workers and their collaborators.
 *
 * <ul>
 *   <li><b>resolutionTimeout</b>: bound on each resolution probe.</li>
 *   <li><b>captureTtl</b>: how long a capture stays fresh in the cache.</li>
 *   <li><b>captureTimeout</b>: bound on each capture provider attempt.</li>
 *   <li><b>pollInterval</b>: Wait poll tick; also how often a Wait notices Stop.</li>
 *   <li><b>actionTimeout</b>: bound on each input command sent to a device.</li>
 * </ul>
 */
public record EngineSettings(
    Duration resolutionTimeout,
    Duration captureTtl,
    Duration captureTimeout,
    Duration pollInterval,
    Duration actionTimeout,
    String adbPath
) {
    public static final Duration DEFAULT_RESOLUTION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CAPTURE_TTL = Duration.ofMillis(1000);
    public static final Duration DEFAULT_CAPTURE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_ACTION_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_ADB_PATH = "adb";

    public EngineSettings {
        requirePositive(resolutionTimeout, "resolutionTimeout");
        Objects.requireNonNull(captureTtl, "captureTtl");
        if (captureTtl.isNegative()) {
            throw new IllegalArgumentException("captureTtl must be non-negative");
        }
        requirePositive(captureTimeout, "captureTimeout");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(actionTimeout, "actionTimeout");
        if (adbPath == null || adbPath.isBlank()) {
            throw new IllegalArgumentException("adbPath must not be blank");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_RESOLUTION_TIMEOUT, DEFAULT_CAPTURE_TTL, DEFAULT_CAPTURE_TIMEOUT,
            DEFAULT_POLL_INTERVAL, DEFAULT_ACTION_TIMEOUT, DEFAULT_ADB_PATH);
    }

    public EngineSettings withResolutionTimeout(Duration value) {
        return new EngineSettings(value, captureTtl, captureTimeout, pollInterval, actionTimeout, adbPath);
    }

    public EngineSettings withCaptureTtl(Duration value) {
        return new EngineSettings(resolutionTimeout, value, captureTimeout, pollInterval, actionTimeout, adbPath);
    }

    public EngineSettings withPollInterval(Duration value) {
        return new EngineSettings(resolutionTimeout, captureTtl, captureTimeout, value, actionTimeout, adbPath);
    }

    public EngineSettings withAdbPath(String value) {
        return new EngineSettings(resolutionTimeout, captureTtl, captureTimeout, pollInterval, actionTimeout, value);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
