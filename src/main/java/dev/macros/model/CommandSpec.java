package dev.macros.model;

import java.time.Duration;
import java.util.List;

/**
 * The variant-specific part of a {@link Command}. Field constraints are checked here,
 * when the variant is built, never when it is dispatched.
 */
public sealed interface CommandSpec {

    CommandKind kind();

    record Click(
        ButtonType button,
        int x,
        int y,
        int humanizeDelayMinMs,
        int humanizeDelayMaxMs,
        Integer wheelDelta // nullable, backend default when absent
    ) implements CommandSpec {
        public static final int DEFAULT_DELAY_MIN_MS = 50;
        public static final int DEFAULT_DELAY_MAX_MS = 200;

        public Click {
            require(button != null, "Click requires a button");
            requireRange("humanizeDelayMinMs", humanizeDelayMinMs, humanizeDelayMaxMs);
        }

        public static Click at(int x, int y) {
            return new Click(ButtonType.LEFT, x, y, DEFAULT_DELAY_MIN_MS, DEFAULT_DELAY_MAX_MS, null);
        }

        @Override
        public CommandKind kind() { return CommandKind.CLICK; }
    }

    record CropImage(
        Region region,
        Rgb targetColor,
        int tolerance,
        ScanMode scanMode,
        String outputVar
    ) implements CommandSpec {
        public static final int DEFAULT_TOLERANCE = 10;
        public static final String DEFAULT_OUTPUT_VAR = "crop_result";

        public CropImage {
            require(region != null, "CropImage requires a region");
            require(targetColor != null, "CropImage requires a target color");
            require(scanMode != null, "CropImage requires a scan mode");
            require(tolerance >= 0 && tolerance <= 255,
                "CropImage tolerance out of range 0-255: " + tolerance);
            require(outputVar != null && !outputVar.isBlank(), "CropImage requires an output variable");
        }

        @Override
        public CommandKind kind() { return CommandKind.CROP_IMAGE; }
    }

    record KeyPress(String key, int repeat, int delayBetweenMs) implements CommandSpec {
        public static final int DEFAULT_DELAY_MS = 100;

        public KeyPress {
            require(key != null && !key.isBlank(), "KeyPress requires a key");
            require(repeat >= 1, "KeyPress repeat must be at least 1: " + repeat);
            require(delayBetweenMs >= 0, "KeyPress delay must be non-negative: " + delayBetweenMs);
        }

        public static KeyPress once(String key) {
            return new KeyPress(key, 1, DEFAULT_DELAY_MS);
        }

        @Override
        public CommandKind kind() { return CommandKind.KEY_PRESS; }
    }

    record HotKey(List<String> keys, HotKeyOrder order) implements CommandSpec {
        public HotKey {
            require(keys != null && !keys.isEmpty(), "HotKey requires at least one key");
            require(keys.stream().noneMatch(k -> k == null || k.isBlank()), "HotKey keys must not be blank");
            require(order != null, "HotKey requires an order");
            keys = List.copyOf(keys);
        }

        @Override
        public CommandKind kind() { return CommandKind.HOT_KEY; }
    }

    record Text(
        String content,
        TextMode mode,
        int speedMinCps,
        int speedMaxCps,
        Integer focusX, // nullable
        Integer focusY  // nullable
    ) implements CommandSpec {
        public static final int DEFAULT_SPEED_MIN_CPS = 10;
        public static final int DEFAULT_SPEED_MAX_CPS = 30;

        public Text {
            require(content != null, "Text requires content");
            require(mode != null, "Text requires a mode");
            if (mode == TextMode.HUMANIZE) {
                require(speedMinCps >= 1, "Text speed must be at least 1 char/sec: " + speedMinCps);
                requireRange("speedMinCps", speedMinCps, speedMaxCps);
            }
            require((focusX == null) == (focusY == null), "Text focus needs both x and y");
        }

        public boolean hasFocus() {
            return focusX != null;
        }

        @Override
        public CommandKind kind() { return CommandKind.TEXT; }
    }

    /** Pixel a PixelColor wait watches. */
    record PixelProbe(int x, int y, Rgb color, int tolerance) {
        public static final int DEFAULT_TOLERANCE = 10;

        public PixelProbe {
            require(color != null, "PixelColor wait requires a color");
            require(tolerance >= 0 && tolerance <= 255, "Pixel tolerance out of range 0-255: " + tolerance);
        }
    }

    /** Region a ScreenChange wait watches; {@code region == null} watches the whole surface. */
    record ScreenProbe(Region region, double threshold) {
        public static final double DEFAULT_THRESHOLD = 0.9;

        public ScreenProbe {
            require(threshold >= 0.0 && threshold <= 1.0, "Screen threshold out of range 0-1: " + threshold);
        }
    }

    record Wait(
        WaitMode mode,
        Duration timeout,
        PixelProbe pixel,   // required for PixelColor
        ScreenProbe screen  // required for ScreenChange
    ) implements CommandSpec {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

        public Wait {
            require(mode != null, "Wait requires a mode");
            require(timeout != null && !timeout.isNegative(), "Wait timeout must be non-negative");
            require(mode != WaitMode.PIXEL_COLOR || pixel != null, "PixelColor wait requires pixel, color and tolerance");
            require(mode != WaitMode.SCREEN_CHANGE || screen != null, "ScreenChange wait requires a threshold");
        }

        public static Wait forDuration(Duration timeout) {
            return new Wait(WaitMode.TIMEOUT, timeout, null, null);
        }

        @Override
        public CommandKind kind() { return CommandKind.WAIT; }
    }

    record Repeat(
        int count, // 0 = unbounded, governed by the script's maxIterations
        String untilExpr, // nullable
        List<Command> innerCommands
    ) implements CommandSpec {
        public Repeat {
            require(count >= 0, "Repeat count must be non-negative: " + count);
            require(innerCommands != null && !innerCommands.isEmpty(), "Repeat requires inner commands");
            require(untilExpr == null || !untilExpr.isBlank(), "Repeat until-condition must not be blank");
            innerCommands = List.copyOf(innerCommands);
        }

        @Override
        public CommandKind kind() { return CommandKind.REPEAT; }
    }

    record Goto(String targetLabel, String guardExpr /* nullable */) implements CommandSpec {
        public Goto {
            require(targetLabel != null && !targetLabel.isBlank(), "Goto requires a target label");
            require(guardExpr == null || !guardExpr.isBlank(), "Goto guard must not be blank");
        }

        @Override
        public CommandKind kind() { return CommandKind.GOTO; }
    }

    record Condition(
        String expr,
        String thenLabel, // nullable
        String elseLabel, // nullable
        List<Command> nestedThen,
        List<Command> nestedElse
    ) implements CommandSpec {
        public Condition {
            require(expr != null && !expr.isBlank(), "Condition requires an expression");
            nestedThen = nestedThen == null ? List.of() : List.copyOf(nestedThen);
            nestedElse = nestedElse == null ? List.of() : List.copyOf(nestedElse);
        }

        @Override
        public CommandKind kind() { return CommandKind.CONDITION; }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    private static void requireRange(String field, int min, int max) {
        require(min >= 0, field + " must be non-negative: " + min);
        require(min <= max, "%s range is inverted: [%d, %d]".formatted(field, min, max));
    }
}
