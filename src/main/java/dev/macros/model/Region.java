package dev.macros.model;

/**
 * Rectangle in logical coordinates, {@code [x1, x2) x [y1, y2)}.
 */
public record Region(int x1, int y1, int x2, int y2) {

    public Region {
        if (x1 < 0 || y1 < 0) {
            throw new ConfigurationException("Region origin must be non-negative: (%d,%d)".formatted(x1, y1));
        }
        if (x2 <= x1 || y2 <= y1) {
            throw new ConfigurationException(
                "Region must have positive size: (%d,%d)-(%d,%d)".formatted(x1, y1, x2, y2));
        }
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }
}
