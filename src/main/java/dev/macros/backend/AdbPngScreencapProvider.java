package dev.macros.backend;

import dev.macros.capture.CaptureException;
import dev.macros.capture.CaptureProvider;
import dev.macros.capture.Frame;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Fallback capture path: {@code screencap -p}, decoded with ImageIO.
 */
public final class AdbPngScreencapProvider implements CaptureProvider {

    private final DeviceShell shell;

    public AdbPngScreencapProvider(DeviceShell shell) {
        this.shell = Objects.requireNonNull(shell, "shell");
    }

    @Override
    public String name() {
        return "adb-png";
    }

    @Override
    public Frame capture(String target, Duration timeout) throws CaptureException {
        byte[] png;
        try {
            png = shell.execOut(target, List.of("screencap", "-p"), timeout);
        } catch (TimeoutException e) {
            throw new CaptureException("screencap -p timed out after " + timeout.toMillis() + " ms", true);
        } catch (IOException e) {
            throw new CaptureException("screencap -p failed", e);
        }
        return decode(png, name());
    }

    static Frame decode(byte[] png, String provider) throws CaptureException {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(png));
        } catch (IOException e) {
            throw new CaptureException("PNG decode failed", e);
        }
        if (image == null) {
            throw new CaptureException("screencap -p output is not a PNG", false);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        return new Frame(width, height, pixels, provider);
    }
}
