package dev.macros.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything a run of the CLI needs besides the script itself.
 */
public record RunnerConfig(
    EngineSettings settings,
    List<TargetConfig> targets,
    Path assignmentsFile // nullable
) {
    public RunnerConfig {
        Objects.requireNonNull(settings, "settings");
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig(EngineSettings.defaults(), List.of(), null);
    }

    public RunnerConfig withSettings(EngineSettings newSettings) {
        return new RunnerConfig(newSettings, targets, assignmentsFile);
    }
}
