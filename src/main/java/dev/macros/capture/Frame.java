package dev.macros.capture;

import dev.macros.model.Region;

import java.util.Arrays;
import java.util.Objects;

/**
 * A captured screen image as packed 0xAARRGGBB pixels, row-major. Immutable: the
 * pixel array is copied on the way in and on the way out, so a cached frame can be
 * shared between workers.
 */
public record Frame(int width, int height, int[] pixels, String provider) {

    public Frame {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame must be positive: %dx%d".formatted(width, height));
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Frame of %dx%d needs %d pixels, got %s".formatted(
                width, height, width * height, pixels == null ? "none" : String.valueOf(pixels.length)));
        }
        pixels = pixels.clone();
    }

    /** A frame filled with one color. */
    public static Frame solid(int width, int height, int argb, String provider) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argb);
        return new Frame(width, height, pixels, provider);
    }

    /** Copy of the pixel data. */
    @Override
    public int[] pixels() {
        return pixels.clone();
    }

    public int pixel(int x, int y) {
        checkPixel(x, y);
        return pixels[y * width + x];
    }

    /** A copy of this frame with one pixel replaced. */
    public Frame withPixel(int x, int y, int argb) {
        checkPixel(x, y);
        int[] copy = pixels.clone();
        copy[y * width + x] = argb;
        return new Frame(width, height, copy, provider);
    }

    public Region bounds() {
        return new Region(0, 0, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Frame other
            && width == other.width
            && height == other.height
            && Objects.equals(provider, other.provider)
            && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height, provider) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "Frame[%dx%d from %s]".formatted(width, height, provider);
    }

    private void checkPixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (%d,%d) outside %dx%d frame".formatted(x, y, width, height));
        }
    }
}
