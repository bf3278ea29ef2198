package dev.macros.capture;

import dev.macros.model.Region;
import dev.macros.model.Rgb;
import dev.macros.model.ScanMode;

import java.util.Optional;

/**
 * Searches a frame region for a color. A pixel matches when every channel is within
 * {@code tolerance} of the target; confidence is {@code 1 - (|dr|+|dg|+|db|) / 765}.
 */
public final class ColorScanner {

    /** Sampling stride of {@link ScanMode#GRID}, from the region's top-left corner. */
    public static final int GRID_STRIDE = 10;

    private static final double MAX_TOTAL_DELTA = 255.0 * 3;

    private ColorScanner() {}

    /**
     * @param region rectangle in frame pixels
     */
    public static Optional<ColorMatch> scan(Frame frame, Region region, Rgb target, int tolerance, ScanMode mode) {
        int x2 = Math.min(region.x2(), frame.width());
        int y2 = Math.min(region.y2(), frame.height());
        int stride = mode == ScanMode.GRID ? GRID_STRIDE : 1;

        int bestX = -1;
        int bestY = -1;
        int bestDelta = Integer.MAX_VALUE;

        for (int y = region.y1(); y < y2; y += stride) {
            for (int x = region.x1(); x < x2; x += stride) {
                int argb = frame.pixel(x, y);
                if (target.maxChannelDelta(argb) > tolerance) {
                    continue;
                }
                int delta = target.totalDelta(argb);
                if (mode == ScanMode.EXACT) {
                    return Optional.of(match(x, y, delta));
                }
                if (delta < bestDelta) {
                    bestDelta = delta;
                    bestX = x;
                    bestY = y;
                }
            }
        }
        return bestX < 0 ? Optional.empty() : Optional.of(match(bestX, bestY, bestDelta));
    }

    private static ColorMatch match(int x, int y, int delta) {
        return new ColorMatch(x, y, 1.0 - delta / MAX_TOTAL_DELTA);
    }
}
