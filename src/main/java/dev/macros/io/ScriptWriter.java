package dev.macros.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.macros.model.Command;
import dev.macros.model.CommandSpec;
import dev.macros.model.OnFail;
import dev.macros.model.Region;
import dev.macros.model.Script;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static dev.macros.io.ScriptFormat.*;

/**
 * Writes scripts in the format {@link ScriptLoader} reads. Every field is written,
 * defaults included, so a saved script reloads to the same commands in the same
 * order. Enabled flags reflect runtime toggles at the time of writing.
 */
public final class ScriptWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ScriptWriter() {}

    public static String writeToString(Script script) throws IOException {
        return MAPPER.writeValueAsString(toJson(script));
    }

    public static void writeToFile(Script script, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), toJson(script));
    }

    static ObjectNode toJson(Script script) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(F_VERSION, VERSION);
        root.put(F_MAX_ITERATIONS, script.maxIterations());
        ObjectNode variables = root.putObject(F_VARIABLES);
        for (Map.Entry<String, Object> e : script.variablesGlobal().entrySet()) {
            variables.set(e.getKey(), MAPPER.valueToTree(e.getValue()));
        }
        writeCommands(root.putArray(F_SEQUENCE), script.effectiveSequence());
        Command handler = script.onErrorHandler();
        if (handler == null) {
            root.putNull(F_ON_ERROR);
        } else {
            writeCommand(root.putObject(F_ON_ERROR), handler.withEnabled(script.isEnabled(handler)));
        }
        return root;
    }

    private static void writeCommands(ArrayNode array, List<Command> commands) {
        for (Command command : commands) {
            writeCommand(array.addObject(), command);
        }
    }

    private static void writeCommand(ObjectNode node, Command command) {
        node.put(F_ID, command.id());
        if (command.parentId() != null) {
            node.put(F_PARENT_ID, command.parentId());
        }
        node.put(F_NAME, command.name());
        node.put(F_TYPE, command.kind().label());
        node.put(F_ENABLED, command.enabled());
        node.put(F_ON_FAIL, command.onFail().label());
        if (command.onFail() instanceof OnFail.GotoLabel gotoLabel) {
            node.put(F_ON_FAIL_LABEL, gotoLabel.target());
        }
        ArrayNode outs = node.putArray(F_VARIABLES_OUT);
        command.variablesOut().forEach(outs::add);
        writeSpec(node, command.spec());
    }

    private static void writeSpec(ObjectNode node, CommandSpec spec) {
        if (spec instanceof CommandSpec.Click c) {
            node.put(F_BUTTON, c.button().label());
            node.put(F_X, c.x());
            node.put(F_Y, c.y());
            node.put(F_DELAY_MIN, c.humanizeDelayMinMs());
            node.put(F_DELAY_MAX, c.humanizeDelayMaxMs());
            putNullable(node, F_WHEEL_DELTA, c.wheelDelta());
        } else if (spec instanceof CommandSpec.CropImage c) {
            writeRegion(node.putObject(F_REGION), c.region());
            node.put(F_TARGET_COLOR, c.targetColor().toString());
            node.put(F_TOLERANCE, c.tolerance());
            node.put(F_SCAN_MODE, c.scanMode().label());
            node.put(F_OUTPUT_VAR, c.outputVar());
        } else if (spec instanceof CommandSpec.KeyPress k) {
            node.put(F_KEY, k.key());
            node.put(F_REPEAT, k.repeat());
            node.put(F_DELAY_BETWEEN, k.delayBetweenMs());
        } else if (spec instanceof CommandSpec.HotKey h) {
            ArrayNode keys = node.putArray(F_KEYS);
            h.keys().forEach(keys::add);
            node.put(F_ORDER, h.order().label());
        } else if (spec instanceof CommandSpec.Text t) {
            node.put(F_CONTENT, t.content());
            node.put(F_MODE, t.mode().label());
            node.put(F_SPEED_MIN, t.speedMinCps());
            node.put(F_SPEED_MAX, t.speedMaxCps());
            putNullable(node, F_FOCUS_X, t.focusX());
            putNullable(node, F_FOCUS_Y, t.focusY());
        } else if (spec instanceof CommandSpec.Wait w) {
            node.put(F_MODE, w.mode().label());
            node.put(F_TIMEOUT_SEC, w.timeout().toMillis() / 1000.0);
            if (w.pixel() != null) {
                node.put(F_PIXEL_X, w.pixel().x());
                node.put(F_PIXEL_Y, w.pixel().y());
                node.put(F_PIXEL_COLOR, w.pixel().color().toString());
                node.put(F_PIXEL_TOLERANCE, w.pixel().tolerance());
            }
            if (w.screen() != null) {
                if (w.screen().region() != null) {
                    writeRegion(node.putObject(F_SCREEN_REGION), w.screen().region());
                }
                node.put(F_SCREEN_THRESHOLD, w.screen().threshold());
            }
        } else if (spec instanceof CommandSpec.Repeat r) {
            node.put(F_COUNT, r.count());
            putNullable(node, F_UNTIL, r.untilExpr());
            writeCommands(node.putArray(F_INNER), r.innerCommands());
        } else if (spec instanceof CommandSpec.Goto g) {
            node.put(F_TARGET_LABEL, g.targetLabel());
            putNullable(node, F_GUARD, g.guardExpr());
        } else if (spec instanceof CommandSpec.Condition c) {
            node.put(F_EXPR, c.expr());
            putNullable(node, F_THEN_LABEL, c.thenLabel());
            putNullable(node, F_ELSE_LABEL, c.elseLabel());
            writeCommands(node.putArray(F_NESTED_THEN), c.nestedThen());
            writeCommands(node.putArray(F_NESTED_ELSE), c.nestedElse());
        }
    }

    private static void writeRegion(ObjectNode node, Region region) {
        node.put("x1", region.x1());
        node.put("y1", region.y1());
        node.put("x2", region.x2());
        node.put("y2", region.y2());
    }

    private static void putNullable(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putNullable(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
