package dev.macros.capture;

/**
 * A single provider failed to capture a target.
 */
public class CaptureException extends Exception {

    private final boolean timeout;

    public CaptureException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
