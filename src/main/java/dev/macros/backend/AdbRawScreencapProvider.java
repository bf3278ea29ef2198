package dev.macros.backend;

import dev.macros.capture.CaptureException;
import dev.macros.capture.CaptureProvider;
import dev.macros.capture.Frame;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Fastest capture path: {@code screencap} without PNG encoding. The dump is a
 * little-endian header (width, height, format and, on newer devices, a color
 * space word) followed by RGBA_8888 pixels.
 */
public final class AdbRawScreencapProvider implements CaptureProvider {

    static final int FORMAT_RGBA_8888 = 1;

    private final DeviceShell shell;

    public AdbRawScreencapProvider(DeviceShell shell) {
        this.shell = Objects.requireNonNull(shell, "shell");
    }

    @Override
    public String name() {
        return "adb-raw";
    }

    @Override
    public Frame capture(String target, Duration timeout) throws CaptureException {
        byte[] raw;
        try {
            raw = shell.execOut(target, List.of("screencap"), timeout);
        } catch (TimeoutException e) {
            throw new CaptureException("screencap timed out after " + timeout.toMillis() + " ms", true);
        } catch (IOException e) {
            throw new CaptureException("screencap failed", e);
        }
        return decode(raw, name());
    }

    static Frame decode(byte[] raw, String provider) throws CaptureException {
        if (raw == null || raw.length < 12) {
            throw new CaptureException("screencap output too short", false);
        }
        int width = readInt(raw, 0);
        int height = readInt(raw, 4);
        int format = readInt(raw, 8);
        if (width <= 0 || height <= 0) {
            throw new CaptureException("screencap header has bad size %dx%d".formatted(width, height), false);
        }
        if (format != FORMAT_RGBA_8888) {
            throw new CaptureException("Unsupported screencap pixel format " + format, false);
        }
        long pixelBytes = (long) width * height * 4;
        long header = raw.length - pixelBytes;
        if (header != 12 && header != 16) {
            throw new CaptureException("screencap size mismatch: %d bytes for %dx%d".formatted(raw.length, width, height), false);
        }
        int[] pixels = new int[width * height];
        int offset = (int) header;
        for (int i = 0; i < pixels.length; i++, offset += 4) {
            int r = raw[offset] & 0xFF;
            int g = raw[offset + 1] & 0xFF;
            int b = raw[offset + 2] & 0xFF;
            int a = raw[offset + 3] & 0xFF;
            pixels[i] = (a << 24) | (r << 16) | (g << 8) | b;
        }
        return new Frame(width, height, pixels, provider);
    }

    private static int readInt(byte[] raw, int at) {
        return (raw[at] & 0xFF) | ((raw[at + 1] & 0xFF) << 8) | ((raw[at + 2] & 0xFF) << 16) | ((raw[at + 3] & 0xFF) << 24);
    }
}
