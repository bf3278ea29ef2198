package dev.macros.coords;

import dev.macros.model.CommandExecutionException;
import dev.macros.model.ErrorKind;

/**
 * A logical coordinate outside {@code [0, width) x [0, height)}. Never clamped.
 */
public class CoordinateOutOfRangeException extends CommandExecutionException {

    public CoordinateOutOfRangeException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.OUT_OF_RANGE;
    }
}
