package dev.macros.capture;

import dev.macros.model.Region;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScreenComparatorTest {

    @Test
    void identicalFramesDoNotDiverge() {
        Frame a = Frame.solid(10, 10, 0xFF808080, "a");

        assertThat(ScreenComparator.divergence(a, Frame.solid(10, 10, 0xFF808080, "b"), a.bounds())).isZero();
    }

    @Test
    void blackToWhiteIsFullDivergence() {
        Frame black = Frame.solid(10, 10, 0xFF000000, "a");
        Frame white = Frame.solid(10, 10, 0xFFFFFFFF, "b");

        assertThat(ScreenComparator.divergence(black, white, black.bounds())).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void onlyTheRegionCounts() {
        Frame before = Frame.solid(10, 10, 0xFF000000, "a");
        Frame after = Frame.solid(10, 10, 0xFF000000, "b").withPixel(9, 9, 0xFFFFFFFF);

        assertThat(ScreenComparator.divergence(before, after, new Region(0, 0, 5, 5))).isZero();
        assertThat(ScreenComparator.divergence(before, after, new Region(5, 5, 10, 10)))
            .isCloseTo(1.0 / 25, within(1e-9));
    }

    @Test
    void differentSizesAreFullyDivergent() {
        Frame small = Frame.solid(5, 5, 0xFF000000, "a");
        Frame large = Frame.solid(10, 10, 0xFF000000, "b");

        assertThat(ScreenComparator.divergence(small, large, small.bounds())).isEqualTo(1.0);
    }
}
