package dev.macros.time;

/**
 * Time source for every timeout, TTL and poll budget in the engine.
 *
 * <p>Wall-clock time is never used for elapsed-time decisions; it can jump.
 * Values are only meaningful as differences.</p>
 */
public interface MonotonicClock {

    /** Monotonically non-decreasing tick in nanoseconds. */
    long nowNanos();
}
