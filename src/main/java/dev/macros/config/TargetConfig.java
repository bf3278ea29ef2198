package dev.macros.config;

import dev.macros.coords.Surface;

/**
 * One target to run against. {@code surface} is the observed physical surface; when
 * null the worker uses the device resolution at the origin.
 */
public record TargetConfig(String id, Surface surface) {

    public TargetConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Target id must not be blank");
        }
    }

    public static TargetConfig of(String id) {
        return new TargetConfig(id, null);
    }
}
