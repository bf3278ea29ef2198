package dev.macros.engine;

/**
 * Lifecycle of a {@link Worker}: {@code IDLE -> RUNNING <-> PAUSED -> STOPPED | COMPLETED | FAILED}.
 */
public enum WorkerState {
    IDLE,
    RUNNING,
    PAUSED,
    STOPPED,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
