package dev.macros.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSettingsTest {

    @Test
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();

        assertThat(settings.resolutionTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.captureTtl()).isEqualTo(Duration.ofMillis(1000));
        assertThat(settings.pollInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(settings.adbPath()).isEqualTo("adb");
    }

    @Test
    void withersReplaceOneField() {
        EngineSettings settings = EngineSettings.defaults().withPollInterval(Duration.ofMillis(5));

        assertThat(settings.pollInterval()).isEqualTo(Duration.ofMillis(5));
        assertThat(settings.withPollInterval(EngineSettings.DEFAULT_POLL_INTERVAL)).isEqualTo(EngineSettings.defaults());
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> EngineSettings.defaults().withResolutionTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.defaults().withCaptureTtl(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineSettings.defaults().withAdbPath(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
