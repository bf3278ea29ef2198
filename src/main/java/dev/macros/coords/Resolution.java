package dev.macros.coords;

/**
 * Display size of a target in pixels.
 */
public record Resolution(int width, int height) {

    public Resolution {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: %dx%d".formatted(width, height));
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
