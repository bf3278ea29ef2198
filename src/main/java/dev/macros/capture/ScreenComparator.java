package dev.macros.capture;

import dev.macros.model.Region;

/**
 * Measures how much a region changed between two frames.
 */
public final class ScreenComparator {

    private ScreenComparator() {}

    /**
     * Mean per-pixel color distance over {@code region}, normalized to 0 (identical)
     * .. 1 (every channel flipped). Frames of different size are fully divergent.
     */
    public static double divergence(Frame baseline, Frame current, Region region) {
        if (baseline.width() != current.width() || baseline.height() != current.height()) {
            return 1.0;
        }
        int x2 = Math.min(region.x2(), current.width());
        int y2 = Math.min(region.y2(), current.height());
        long total = 0;
        long count = 0;
        for (int y = region.y1(); y < y2; y++) {
            for (int x = region.x1(); x < x2; x++) {
                int a = baseline.pixel(x, y);
                int b = current.pixel(x, y);
                total += Math.abs(((a >> 16) & 0xFF) - ((b >> 16) & 0xFF))
                    + Math.abs(((a >> 8) & 0xFF) - ((b >> 8) & 0xFF))
                    + Math.abs((a & 0xFF) - (b & 0xFF));
                count++;
            }
        }
        return count == 0 ? 0.0 : total / (count * 765.0);
    }
}
