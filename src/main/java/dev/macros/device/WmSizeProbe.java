package dev.macros.device;

import dev.macros.coords.Resolution;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Primary probe: {@code wm size}. Output looks like {@code Physical size: 1080x1920},
 * optionally followed by {@code Override size: 720x1280}, which wins when present.
 */
public final class WmSizeProbe implements ResolutionProbe {

    private static final Pattern OVERRIDE = Pattern.compile("Override size:\\s*(\\d+)x(\\d+)");
    private static final Pattern ANY = Pattern.compile("(\\d+)x(\\d+)");

    @Override
    public String name() {
        return "wm size";
    }

    @Override
    public List<String> command() {
        return List.of("wm", "size");
    }

    @Override
    public Optional<Resolution> parse(String output) {
        Matcher override = OVERRIDE.matcher(output);
        if (override.find()) {
            return toResolution(override);
        }
        Matcher any = ANY.matcher(output);
        return any.find() ? toResolution(any) : Optional.empty();
    }

    static Optional<Resolution> toResolution(Matcher m) {
        try {
            int width = Integer.parseInt(m.group(1));
            int height = Integer.parseInt(m.group(2));
            return width > 0 && height > 0 ? Optional.of(new Resolution(width, height)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
