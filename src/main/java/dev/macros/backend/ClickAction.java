package dev.macros.backend;

import dev.macros.coords.Point;
import dev.macros.model.ButtonType;

/**
 * A click at a physical point. The backend waits a random delay in
 * {@code [delayMinMs, delayMaxMs]} before the gesture.
 */
public record ClickAction(ButtonType button, Point point, int delayMinMs, int delayMaxMs, Integer wheelDelta) {

    public static final int DEFAULT_WHEEL_DELTA = 300;

    public int wheelDeltaOrDefault() {
        return wheelDelta == null ? DEFAULT_WHEEL_DELTA : wheelDelta;
    }
}
