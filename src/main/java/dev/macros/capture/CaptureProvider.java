package dev.macros.capture;

import java.time.Duration;

/**
 * One way of grabbing a target's screen. Providers are tried fastest-first by the
 * {@link CaptureCache}; each attempt must return within {@code timeout}.
 */
public interface CaptureProvider {

    /** Display name for diagnostics. */
    String name();

    Frame capture(String target, Duration timeout) throws CaptureException;
}
