package dev.macros.model;

/**
 * Classification of the error that ended (or was recovered during) a run.
 */
public enum ErrorKind {
    CONFIGURATION,
    COMMAND_EXECUTION,
    TIMEOUT,
    OUT_OF_RANGE,
    CAPABILITY,
    ITERATION_LIMIT_EXCEEDED,
    UNEXPECTED
}
