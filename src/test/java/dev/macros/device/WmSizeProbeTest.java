package dev.macros.device;

import dev.macros.coords.Resolution;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WmSizeProbeTest {

    private final WmSizeProbe probe = new WmSizeProbe();

    @Test
    void readsPhysicalSize() {
        assertThat(probe.parse("Physical size: 1080x1920")).contains(new Resolution(1080, 1920));
    }

    @Test
    void overrideSizeWins() {
        assertThat(probe.parse("Physical size: 1080x1920\nOverride size: 720x1280\n"))
            .contains(new Resolution(720, 1280));
    }

    @Test
    void garbageYieldsNothing() {
        assertThat(probe.parse("error: device offline")).isEmpty();
        assertThat(probe.parse("Physical size: 0x0")).isEmpty();
    }

    @Test
    void displayDumpNeedsThreeOrFourDigitSizes() {
        var dump = new DisplayDumpProbe();

        assertThat(dump.parse("mDisplayId=0 12 x 3 app 1440 x 2560")).contains(new Resolution(1440, 2560));
        assertThat(dump.parse("no display")).isEmpty();
    }
}
