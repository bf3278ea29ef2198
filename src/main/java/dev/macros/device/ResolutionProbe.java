package dev.macros.device;

import dev.macros.coords.Resolution;

import java.util.List;
import java.util.Optional;

/**
 * One tier of resolution lookup: a device shell command and the strategy for
 * reading a size out of its output.
 */
public interface ResolutionProbe {

    String name();

    List<String> command();

    Optional<Resolution> parse(String output);
}
