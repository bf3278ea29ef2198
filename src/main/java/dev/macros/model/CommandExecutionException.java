package dev.macros.model;

/**
 * An action or Wait that did not succeed. Caught per command by the run loop and
 * resolved through the command's {@link OnFail} policy.
 */
public class CommandExecutionException extends RuntimeException {

    public CommandExecutionException(String message) {
        super(message);
    }

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind kind() {
        return ErrorKind.COMMAND_EXECUTION;
    }
}
