package dev.macros.io;

/**
 * Field names of the persisted script document.
 */
final class ScriptFormat {

    static final int VERSION = 1;

    static final String F_VERSION = "version";
    static final String F_MAX_ITERATIONS = "maxIterations";
    static final String F_VARIABLES = "variablesGlobal";
    static final String F_SEQUENCE = "sequence";
    static final String F_ON_ERROR = "onErrorHandler";

    static final String F_ID = "id";
    static final String F_PARENT_ID = "parentId";
    static final String F_NAME = "name";
    static final String F_TYPE = "type";
    static final String F_ENABLED = "enabled";
    static final String F_ON_FAIL = "onFail";
    static final String F_ON_FAIL_LABEL = "onFailLabel";
    static final String F_VARIABLES_OUT = "variablesOut";

    static final String F_BUTTON = "button";
    static final String F_X = "x";
    static final String F_Y = "y";
    static final String F_DELAY_MIN = "humanizeDelayMin";
    static final String F_DELAY_MAX = "humanizeDelayMax";
    static final String F_WHEEL_DELTA = "wheelDelta";

    static final String F_REGION = "region";
    static final String F_TARGET_COLOR = "targetColor";
    static final String F_TOLERANCE = "tolerance";
    static final String F_SCAN_MODE = "scanMode";
    static final String F_OUTPUT_VAR = "outputVar";

    static final String F_KEY = "key";
    static final String F_REPEAT = "repeat";
    static final String F_DELAY_BETWEEN = "delayBetweenMs";
    static final String F_KEYS = "keys";
    static final String F_ORDER = "order";

    static final String F_CONTENT = "content";
    static final String F_MODE = "mode";
    static final String F_SPEED_MIN = "speedMin";
    static final String F_SPEED_MAX = "speedMax";
    static final String F_FOCUS_X = "focusX";
    static final String F_FOCUS_Y = "focusY";

    static final String F_TIMEOUT_SEC = "timeoutSec";
    static final String F_PIXEL_X = "pixelX";
    static final String F_PIXEL_Y = "pixelY";
    static final String F_PIXEL_COLOR = "pixelColor";
    static final String F_PIXEL_TOLERANCE = "pixelTolerance";
    static final String F_SCREEN_REGION = "screenRegion";
    static final String F_SCREEN_THRESHOLD = "screenThreshold";

    static final String F_COUNT = "count";
    static final String F_UNTIL = "until";
    static final String F_INNER = "innerCommands";
    static final String F_TARGET_LABEL = "targetLabel";
    static final String F_GUARD = "guard";
    static final String F_EXPR = "expr";
    static final String F_THEN_LABEL = "thenLabel";
    static final String F_ELSE_LABEL = "elseLabel";
    static final String F_NESTED_THEN = "nestedThen";
    static final String F_NESTED_ELSE = "nestedElse";

    private ScriptFormat() {}
}
