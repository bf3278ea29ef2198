package dev.macros.capture;

import java.util.List;

/**
 * Every capture provider failed for a target. Fatal for the worker that asked; the
 * cache does not retry.
 */
public class CapabilityException extends RuntimeException {

    private final String target;
    private final List<String> attempts;

    public CapabilityException(String target, List<String> attempts) {
        super("No capture provider could capture %s: %s".formatted(target, String.join("; ", attempts)));
        this.target = target;
        this.attempts = List.copyOf(attempts);
    }

    public String target() {
        return target;
    }

    public List<String> attempts() {
        return attempts;
    }
}
