package dev.macros.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 * Thread-safe; unaffected by wall-clock adjustments.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
