package dev.macros.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandSpecTest {

    @Test
    void cropToleranceOutsideByteRangeIsRejected() {
        assertThatThrownBy(() -> new CommandSpec.CropImage(new Region(0, 0, 10, 10), new Rgb(1, 2, 3),
            256, ScanMode.EXACT, "out"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("tolerance");
    }

    @Test
    void screenThresholdOutsideUnitRangeIsRejected() {
        assertThatThrownBy(() -> new CommandSpec.ScreenProbe(null, 1.5))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invertedHumanizeRangeIsRejected() {
        assertThatThrownBy(() -> new CommandSpec.Click(ButtonType.LEFT, 0, 0, 300, 100, null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("inverted");
    }

    @Test
    void emptyRepeatIsRejected() {
        assertThatThrownBy(() -> new CommandSpec.Repeat(3, null, List.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void negativeWaitTimeoutIsRejected() {
        assertThatThrownBy(() -> CommandSpec.Wait.forDuration(Duration.ofMillis(-1)))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void textFocusNeedsBothCoordinates() {
        assertThatThrownBy(() -> new CommandSpec.Text("hi", TextMode.PASTE, 10, 30, 5, null))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void regionRequiresPositiveSize() {
        assertThatThrownBy(() -> new Region(10, 10, 10, 20)).isInstanceOf(ConfigurationException.class);
        assertThat(new Region(0, 0, 4, 3).width()).isEqualTo(4);
    }

    @Test
    void colorParsingAcceptsHashPrefix() {
        assertThat(Rgb.parse("#FF8000")).isEqualTo(new Rgb(255, 128, 0));
        assertThat(Rgb.parse("00ff00").toString()).isEqualTo("#00FF00");
        assertThatThrownBy(() -> Rgb.parse("#12")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Rgb.parse("#-00001")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Rgb.parse("+FFFFF")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void onFailRoundTripsThroughItsLabel() {
        assertThat(OnFail.of("Skip", null)).isEqualTo(OnFail.SKIP);
        assertThat(OnFail.of("GotoLabel", "retry")).isEqualTo(new OnFail.GotoLabel("retry"));
        assertThatThrownBy(() -> OnFail.of("GotoLabel", null)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OnFail.of("Retry", null)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void commandKindsSplitIntoActionsAndLogic() {
        assertThat(CommandKind.fromLabel("CropImage").isAction()).isTrue();
        assertThat(CommandKind.fromLabel("Repeat").isAction()).isFalse();
    }
}
