package dev.macros.device;

import dev.macros.coords.Resolution;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Secondary probe: {@code dumpsys display}, scanning the dump for the first
 * {@code W x H} pair of 3-4 digit numbers.
 */
public final class DisplayDumpProbe implements ResolutionProbe {

    private static final Pattern SIZE = Pattern.compile("(\\d{3,4})\\s*x\\s*(\\d{3,4})");

    @Override
    public String name() {
        return "dumpsys display";
    }

    @Override
    public List<String> command() {
        return List.of("dumpsys", "display");
    }

    @Override
    public Optional<Resolution> parse(String output) {
        Matcher m = SIZE.matcher(output);
        return m.find() ? WmSizeProbe.toResolution(m) : Optional.empty();
    }
}
