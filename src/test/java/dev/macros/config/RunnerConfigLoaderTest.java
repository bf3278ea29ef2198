package dev.macros.config;

import dev.macros.coords.Surface;
import dev.macros.model.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunnerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyObjectYieldsDefaults() throws Exception {
        RunnerConfig config = RunnerConfigLoader.loadFromString("{}");

        assertThat(config.settings()).isEqualTo(EngineSettings.defaults());
        assertThat(config.targets()).isEmpty();
        assertThat(config.assignmentsFile()).isNull();
    }

    @Test
    void readsTimingsAndTargets() throws Exception {
        RunnerConfig config = RunnerConfigLoader.loadFromString("""
            {
              "adbPath": "/opt/platform-tools/adb",
              "resolutionTimeoutMs": 2500,
              "captureTtlMs": 0,
              "pollIntervalMs": 20,
              "targets": [
                "emulator-5554",
                {"id": "127.0.0.1:21503", "surface": {"x": 10, "y": 20, "width": 540, "height": 960}}
              ]
            }
            """);

        assertThat(config.settings().adbPath()).isEqualTo("/opt/platform-tools/adb");
        assertThat(config.settings().resolutionTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.settings().captureTtl()).isZero();
        assertThat(config.settings().pollInterval()).isEqualTo(Duration.ofMillis(20));
        assertThat(config.settings().actionTimeout()).isEqualTo(EngineSettings.DEFAULT_ACTION_TIMEOUT);
        assertThat(config.targets()).containsExactly(
            TargetConfig.of("emulator-5554"),
            new TargetConfig("127.0.0.1:21503", new Surface(10, 20, 540, 960)));
    }

    @Test
    void assignmentsFileResolvesAgainstTheConfigDirectory() throws Exception {
        Path file = tempDir.resolve("runner.json");
        Files.writeString(file, "{\"assignmentsFile\": \"workers.json\"}");

        RunnerConfig config = RunnerConfigLoader.loadFromFile(file);

        assertThat(config.assignmentsFile()).isEqualTo(tempDir.toAbsolutePath().resolve("workers.json"));
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString("{\"pollIntervalMs\": 0}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("pollInterval");
    }

    @Test
    void rejectsTextTimings() {
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString("{\"captureTtlMs\": \"soon\"}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("'captureTtlMs' must be a whole number");
    }

    @Test
    void rejectsMalformedTargets() {
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString("{\"targets\": \"emulator-5554\"}"))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString("{\"targets\": [{\"surface\": {}}]}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("missing 'id'");
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString(
            "{\"targets\": [{\"id\": \"a\", \"surface\": {\"width\": 0, \"height\": 10}}]}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid surface");
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThatThrownBy(() -> RunnerConfigLoader.loadFromString("[]"))
            .isInstanceOf(ConfigurationException.class);
    }
}
