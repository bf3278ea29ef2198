package dev.macros.backend;

/**
 * Outcome of one action sent to a device.
 */
public record ActionResult(boolean success, String error) {

    private static final ActionResult OK = new ActionResult(true, null);

    public static ActionResult ok() {
        return OK;
    }

    public static ActionResult failed(String error) {
        return new ActionResult(false, error);
    }
}
