package dev.macros.backend;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over the device input channel (ADB today).
 *
 * <p>All coordinates arriving here are already physical; scaling happens in the
 * engine. Each call is a bounded unit of work that reports failure through
 * {@link ActionResult} rather than by throwing.</p>
 */
public interface DeviceBackend {

    /** Ids of the targets this backend can currently reach. */
    List<String> listTargets() throws IOException;

    ActionResult click(String target, ClickAction action);

    ActionResult keyPress(String target, KeyAction action);

    ActionResult hotKey(String target, HotKeyAction action);

    ActionResult text(String target, TextAction action);

    /** Get backend display name. */
    String getName();
}
