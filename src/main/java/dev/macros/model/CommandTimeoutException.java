package dev.macros.model;

/**
 * A Wait or device query ran out of time.
 */
public class CommandTimeoutException extends CommandExecutionException {

    public CommandTimeoutException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
