package dev.macros.coords;

/**
 * Observed drawing surface of a target inside the addressable input space:
 * top-left origin plus size. For a device addressed directly the origin is (0,0).
 */
public record Surface(int originX, int originY, int width, int height) {

    public Surface {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Surface must be positive: %dx%d".formatted(width, height));
        }
    }

    public static Surface atOrigin(int width, int height) {
        return new Surface(0, 0, width, height);
    }

    public Resolution size() {
        return new Resolution(width, height);
    }
}
