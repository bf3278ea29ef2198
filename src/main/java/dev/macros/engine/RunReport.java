package dev.macros.engine;

import dev.macros.model.ErrorKind;

import java.time.Duration;
import java.util.Map;

/**
 * How a run ended. A failed run names its last command and the error kind; every
 * run reports the iterations it used and how long it took.
 */
public record RunReport(
    String target,
    WorkerState state,
    int iterationCount,
    Duration elapsed,
    String lastCommandId,   // nullable
    String lastCommandName, // nullable
    ErrorKind errorKind,    // null unless FAILED
    String errorMessage,    // null unless FAILED
    Map<String, Object> variables
) {
    public RunReport {
        variables = variables == null ? Map.of() : variables;
    }

    public boolean completed() {
        return state == WorkerState.COMPLETED;
    }

    /** One-line summary for logs and the CLI. */
    public String summary() {
        String base = "%s: %s after %d iterations in %d ms".formatted(
            target, state, iterationCount, elapsed.toMillis());
        if (state == WorkerState.FAILED) {
            return base + " at '%s' (%s: %s)".formatted(lastCommandName, errorKind, errorMessage);
        }
        return base;
    }
}
