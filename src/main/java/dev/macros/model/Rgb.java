package dev.macros.model;

import java.util.regex.Pattern;

/**
 * An opaque color, each channel 0-255.
 */
public record Rgb(int r, int g, int b) {

    private static final Pattern HEX = Pattern.compile("[0-9A-Fa-f]{6}");

    public Rgb {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    /** Extract the color from a packed 0xAARRGGBB pixel, ignoring alpha. */
    public static Rgb ofPacked(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    /** Parse {@code #RRGGBB} or {@code RRGGBB}. */
    public static Rgb parse(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (!HEX.matcher(digits).matches()) {
            throw new ConfigurationException("Invalid color '%s'".formatted(hex));
        }
        return ofPacked(Integer.parseInt(digits, 16));
    }

    /** Largest per-channel difference to a packed pixel. */
    public int maxChannelDelta(int argb) {
        int dr = Math.abs(r - ((argb >> 16) & 0xFF));
        int dg = Math.abs(g - ((argb >> 8) & 0xFF));
        int db = Math.abs(b - (argb & 0xFF));
        return Math.max(dr, Math.max(dg, db));
    }

    /** Sum of per-channel differences to a packed pixel, 0-765. */
    public int totalDelta(int argb) {
        return Math.abs(r - ((argb >> 16) & 0xFF))
            + Math.abs(g - ((argb >> 8) & 0xFF))
            + Math.abs(b - (argb & 0xFF));
    }

    @Override
    public String toString() {
        return "#%02X%02X%02X".formatted(r, g, b);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new ConfigurationException("Color channel %s out of range 0-255: %d".formatted(name, value));
        }
    }
}
