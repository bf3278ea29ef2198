package dev.macros.backend;

import dev.macros.coords.Point;
import dev.macros.model.HotKeyOrder;
import dev.macros.model.TextMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.TimeoutException;

/**
 * Sends input to Android targets with {@code adb shell input}.
 */
public final class AdbDeviceBackend implements DeviceBackend {

    private static final Logger log = LoggerFactory.getLogger(AdbDeviceBackend.class);

    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    static final int DOUBLE_TAP_GAP_MS = 80;
    static final int LONG_PRESS_MS = 600;
    static final int WHEEL_SWIPE_MS = 250;

    private final DeviceShell shell;
    private final Duration commandTimeout;
    private final Sleeper sleeper;
    private final Random random;

    public AdbDeviceBackend(DeviceShell shell, Duration commandTimeout, Sleeper sleeper, Random random) {
        this.shell = Objects.requireNonNull(shell, "shell");
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    public AdbDeviceBackend(DeviceShell shell) {
        this(shell, DEFAULT_COMMAND_TIMEOUT, Sleeper.SYSTEM, new Random());
    }

    @Override
    public List<String> listTargets() throws IOException {
        try {
            return shell.devices(commandTimeout);
        } catch (TimeoutException e) {
            throw new IOException("Listing devices timed out", e);
        }
    }

    @Override
    public ActionResult click(String target, ClickAction action) {
        return perform(target, "click", () -> {
            sleeper.sleep(sample(action.delayMinMs(), action.delayMaxMs()));
            Point p = action.point();
            switch (action.button()) {
                case LEFT -> tap(target, p);
                case DOUBLE -> {
                    tap(target, p);
                    sleeper.sleep(DOUBLE_TAP_GAP_MS);
                    tap(target, p);
                }
                case RIGHT -> swipe(target, p, p, LONG_PRESS_MS);
                case WHEEL_UP -> swipe(target, p, new Point(p.x(), p.y() + action.wheelDeltaOrDefault()), WHEEL_SWIPE_MS);
                case WHEEL_DOWN -> swipe(target, p,
                    new Point(p.x(), Math.max(0, p.y() - action.wheelDeltaOrDefault())), WHEEL_SWIPE_MS);
            }
        });
    }

    @Override
    public ActionResult keyPress(String target, KeyAction action) {
        return perform(target, "keyPress", () -> {
            String code = AdbKeys.keyCode(action.key());
            for (int i = 0; i < action.repeat(); i++) {
                if (i > 0) {
                    sleeper.sleep(action.delayBetweenMs());
                }
                input(target, "keyevent", code);
            }
        });
    }

    @Override
    public ActionResult hotKey(String target, HotKeyAction action) {
        return perform(target, "hotKey", () -> {
            var codes = action.keys().stream().map(AdbKeys::keyCode).toList();
            if (action.order() == HotKeyOrder.SIMULTANEOUS) {
                var args = new ArrayList<String>();
                args.add("keycombination");
                args.addAll(codes);
                input(target, args.toArray(String[]::new));
            } else {
                for (String code : codes) {
                    input(target, "keyevent", code);
                }
            }
        });
    }

    @Override
    public ActionResult text(String target, TextAction action) {
        return perform(target, "text", () -> {
            if (action.focus() != null) {
                tap(target, action.focus());
            }
            if (action.mode() == TextMode.PASTE) {
                if (!action.content().isEmpty()) {
                    input(target, "text", AdbKeys.escapeText(action.content()));
                }
                return;
            }
            int cps = sample(action.speedMinCps(), action.speedMaxCps());
            long perCharMs = Math.max(1, 1000L / Math.max(1, cps));
            int[] codePoints = action.content().codePoints().toArray();
            for (int i = 0; i < codePoints.length; i++) {
                if (i > 0) {
                    sleeper.sleep(perCharMs);
                }
                input(target, "text", AdbKeys.escapeText(new String(codePoints, i, 1)));
            }
        });
    }

    @Override
    public String getName() {
        return "adb";
    }

    private void tap(String target, Point p) throws IOException, TimeoutException {
        input(target, "tap", Integer.toString(p.x()), Integer.toString(p.y()));
    }

    private void swipe(String target, Point from, Point to, int durationMs) throws IOException, TimeoutException {
        input(target, "swipe", Integer.toString(from.x()), Integer.toString(from.y()),
            Integer.toString(to.x()), Integer.toString(to.y()), Integer.toString(durationMs));
    }

    private void input(String target, String... args) throws IOException, TimeoutException {
        var command = new ArrayList<String>(args.length + 1);
        command.add("input");
        command.addAll(List.of(args));
        shell.shell(target, command, commandTimeout);
    }

    private int sample(int min, int max) {
        return max <= min ? min : min + random.nextInt(max - min + 1);
    }

    private ActionResult perform(String target, String what, InputSequence sequence) {
        try {
            sequence.run();
            return ActionResult.ok();
        } catch (TimeoutException e) {
            log.warn("{}: {} timed out: {}", target, what, e.getMessage());
            return ActionResult.failed(what + " timed out: " + e.getMessage());
        } catch (IOException e) {
            log.warn("{}: {} failed: {}", target, what, e.getMessage());
            return ActionResult.failed(what + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failed(what + " interrupted");
        }
    }

    @FunctionalInterface
    private interface InputSequence {
        void run() throws IOException, TimeoutException, InterruptedException;
    }
}
