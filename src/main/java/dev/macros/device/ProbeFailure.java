package dev.macros.device;

/**
 * Why one resolution probe produced nothing.
 */
public record ProbeFailure(String probe, Reason reason, String detail) {

    public enum Reason {
        INVALID_ID,
        TIMEOUT,
        TRANSPORT,
        UNPARSEABLE
    }

    @Override
    public String toString() {
        return "%s: %s (%s)".formatted(probe, reason, detail);
    }
}
