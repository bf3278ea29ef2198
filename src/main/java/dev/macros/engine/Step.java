package dev.macros.engine;

import dev.macros.model.ErrorKind;

/**
 * Where control goes after a command. Jumps always name a top-level command.
 */
sealed interface Step {

    Next NEXT = new Next();

    record Next() implements Step {}

    record Jump(String commandId) implements Step {}

    record Halt(WorkerState state, ErrorKind kind, String message) implements Step {
        static Halt stopped() {
            return new Halt(WorkerState.STOPPED, null, null);
        }

        static Halt failed(ErrorKind kind, String message) {
            return new Halt(WorkerState.FAILED, kind, message);
        }
    }
}
