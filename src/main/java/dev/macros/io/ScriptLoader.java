package dev.macros.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.macros.model.ButtonType;
import dev.macros.model.Command;
import dev.macros.model.CommandKind;
import dev.macros.model.CommandSpec;
import dev.macros.model.ConfigurationException;
import dev.macros.model.HotKeyOrder;
import dev.macros.model.OnFail;
import dev.macros.model.Region;
import dev.macros.model.Rgb;
import dev.macros.model.ScanMode;
import dev.macros.model.Script;
import dev.macros.model.TextMode;
import dev.macros.model.WaitMode;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static dev.macros.io.ScriptFormat.*;

/**
 * Loads scripts from the versioned JSON format. Optional fields take their
 * documented defaults; commands without an id get a fresh one; children without a
 * {@code parentId} are attributed to the command that holds them.
 */
public final class ScriptLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ScriptLoader() {}

    /**
     * Load a script from a JSON file.
     *
     * @throws ConfigurationException if the document is not a valid script
     */
    public static Script loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseScript(root);
    }

    /**
     * Load a script from a JSON string.
     */
    public static Script loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseScript(root);
    }

    private static Script parseScript(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Script document must be a JSON object");
        }
        int version = integer(root, F_VERSION, VERSION);
        if (version < 1 || version > VERSION) {
            throw new ConfigurationException(
                "Unsupported script version %d (supported: %d)".formatted(version, VERSION));
        }
        int maxIterations = integer(root, F_MAX_ITERATIONS, Script.DEFAULT_MAX_ITERATIONS);

        Map<String, Object> variables = parseVariables(root.get(F_VARIABLES));

        JsonNode sequenceNode = root.get(F_SEQUENCE);
        if (sequenceNode != null && !sequenceNode.isArray()) {
            throw new ConfigurationException("'sequence' must be an array");
        }
        List<Command> sequence = parseCommands(sequenceNode, null, "sequence");

        Command onError = null;
        JsonNode onErrorNode = root.get(F_ON_ERROR);
        if (onErrorNode != null && !onErrorNode.isNull()) {
            onError = parseCommand(onErrorNode, null, F_ON_ERROR);
        }
        return new Script(sequence, variables, maxIterations, onError);
    }

    private static Map<String, Object> parseVariables(JsonNode node) {
        var variables = new LinkedHashMap<String, Object>();
        if (node == null || node.isNull()) {
            return variables;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'variablesGlobal' must be an object");
        }
        for (var entry : node.properties()) {
            variables.put(entry.getKey(), toValue(entry.getValue()));
        }
        return variables;
    }

    private static Object toValue(JsonNode node) {
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Unreadable variable value: " + node, e);
        }
    }

    private static List<Command> parseCommands(JsonNode array, String enclosingId, String path) {
        var commands = new ArrayList<Command>();
        if (array == null || array.isNull()) {
            return commands;
        }
        if (!array.isArray()) {
            throw new ConfigurationException("'%s' must be an array".formatted(path));
        }
        int i = 0;
        for (JsonNode node : array) {
            commands.add(parseCommand(node, enclosingId, "%s[%d]".formatted(path, i++)));
        }
        return commands;
    }

    private static Command parseCommand(JsonNode node, String enclosingId, String path) {
        if (!node.isObject()) {
            throw new ConfigurationException("%s: command must be an object".formatted(path));
        }
        String id = text(node, F_ID, null);
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        String name = text(node, F_NAME, null);
        String where = name != null ? "%s '%s'".formatted(path, name) : path;
        try {
            String parentId = text(node, F_PARENT_ID, enclosingId);
            CommandKind kind = CommandKind.fromLabel(required(node, F_TYPE).asText());
            boolean enabled = bool(node, F_ENABLED, true);
            OnFail onFail = OnFail.of(text(node, F_ON_FAIL, "Skip"), text(node, F_ON_FAIL_LABEL, null));

            var variablesOut = new ArrayList<String>();
            JsonNode outs = node.get(F_VARIABLES_OUT);
            if (outs != null && outs.isArray()) {
                outs.forEach(o -> variablesOut.add(o.asText()));
            }

            CommandSpec spec = parseSpec(kind, node, id, path);
            return new Command(id, parentId, name, enabled, onFail, variablesOut, spec);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("%s: %s".formatted(where, e.getMessage()), e);
        }
    }

    private static CommandSpec parseSpec(CommandKind kind, JsonNode node, String id, String path) {
        return switch (kind) {
            case CLICK -> new CommandSpec.Click(
                ButtonType.fromLabel(text(node, F_BUTTON, ButtonType.LEFT.label())),
                requiredInt(node, F_X),
                requiredInt(node, F_Y),
                integer(node, F_DELAY_MIN, CommandSpec.Click.DEFAULT_DELAY_MIN_MS),
                integer(node, F_DELAY_MAX, CommandSpec.Click.DEFAULT_DELAY_MAX_MS),
                optionalInt(node, F_WHEEL_DELTA));
            case CROP_IMAGE -> new CommandSpec.CropImage(
                region(required(node, F_REGION)),
                Rgb.parse(required(node, F_TARGET_COLOR).asText()),
                integer(node, F_TOLERANCE, CommandSpec.CropImage.DEFAULT_TOLERANCE),
                ScanMode.fromLabel(text(node, F_SCAN_MODE, ScanMode.EXACT.label())),
                text(node, F_OUTPUT_VAR, CommandSpec.CropImage.DEFAULT_OUTPUT_VAR));
            case KEY_PRESS -> new CommandSpec.KeyPress(
                required(node, F_KEY).asText(),
                integer(node, F_REPEAT, 1),
                integer(node, F_DELAY_BETWEEN, CommandSpec.KeyPress.DEFAULT_DELAY_MS));
            case HOT_KEY -> new CommandSpec.HotKey(
                strings(required(node, F_KEYS)),
                HotKeyOrder.fromLabel(text(node, F_ORDER, HotKeyOrder.SIMULTANEOUS.label())));
            case TEXT -> new CommandSpec.Text(
                required(node, F_CONTENT).asText(),
                TextMode.fromLabel(text(node, F_MODE, TextMode.PASTE.label())),
                integer(node, F_SPEED_MIN, CommandSpec.Text.DEFAULT_SPEED_MIN_CPS),
                integer(node, F_SPEED_MAX, CommandSpec.Text.DEFAULT_SPEED_MAX_CPS),
                optionalInt(node, F_FOCUS_X),
                optionalInt(node, F_FOCUS_Y));
            case WAIT -> parseWait(node);
            case REPEAT -> new CommandSpec.Repeat(
                integer(node, F_COUNT, 0),
                text(node, F_UNTIL, null),
                parseCommands(node.get(F_INNER), id, path + "." + F_INNER));
            case GOTO -> new CommandSpec.Goto(
                required(node, F_TARGET_LABEL).asText(),
                text(node, F_GUARD, null));
            case CONDITION -> new CommandSpec.Condition(
                required(node, F_EXPR).asText(),
                text(node, F_THEN_LABEL, null),
                text(node, F_ELSE_LABEL, null),
                parseCommands(node.get(F_NESTED_THEN), id, path + "." + F_NESTED_THEN),
                parseCommands(node.get(F_NESTED_ELSE), id, path + "." + F_NESTED_ELSE));
        };
    }

    private static CommandSpec.Wait parseWait(JsonNode node) {
        WaitMode mode = WaitMode.fromLabel(text(node, F_MODE, WaitMode.TIMEOUT.label()));
        Duration timeout = node.hasNonNull(F_TIMEOUT_SEC)
            ? Duration.ofMillis(Math.round(number(node, F_TIMEOUT_SEC, 0) * 1000))
            : CommandSpec.Wait.DEFAULT_TIMEOUT;

        CommandSpec.PixelProbe pixel = null;
        if (mode == WaitMode.PIXEL_COLOR || node.has(F_PIXEL_COLOR)) {
            pixel = new CommandSpec.PixelProbe(
                requiredInt(node, F_PIXEL_X),
                requiredInt(node, F_PIXEL_Y),
                Rgb.parse(required(node, F_PIXEL_COLOR).asText()),
                integer(node, F_PIXEL_TOLERANCE, CommandSpec.PixelProbe.DEFAULT_TOLERANCE));
        }
        CommandSpec.ScreenProbe screen = null;
        if (mode == WaitMode.SCREEN_CHANGE || node.has(F_SCREEN_THRESHOLD) || node.hasNonNull(F_SCREEN_REGION)) {
            JsonNode regionNode = node.get(F_SCREEN_REGION);
            screen = new CommandSpec.ScreenProbe(
                regionNode == null || regionNode.isNull() ? null : region(regionNode),
                number(node, F_SCREEN_THRESHOLD, CommandSpec.ScreenProbe.DEFAULT_THRESHOLD));
        }
        return new CommandSpec.Wait(mode, timeout, pixel, screen);
    }

    private static Region region(JsonNode node) {
        return new Region(requiredInt(node, "x1"), requiredInt(node, "y1"),
            requiredInt(node, "x2"), requiredInt(node, "y2"));
    }

    private static List<String> strings(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigurationException("expected an array of strings, got " + node);
        }
        var values = new ArrayList<String>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("missing required field '%s'".formatted(field));
        }
        return value;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static int requiredInt(JsonNode node, String field) {
        return intValue(required(node, field), field);
    }

    private static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : intValue(value, field);
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : intValue(value, field);
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isNumber()) {
            throw new ConfigurationException("field '%s' must be a number, got %s".formatted(field, value));
        }
        return value.asDouble();
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isBoolean()) {
            throw new ConfigurationException("field '%s' must be true or false, got %s".formatted(field, value));
        }
        return value.booleanValue();
    }

    // integral and within int range
    private static int intValue(JsonNode value, String field) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigurationException("field '%s' must be an integer, got %s".formatted(field, value));
        }
        return value.intValue();
    }
}
