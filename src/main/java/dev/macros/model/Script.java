package dev.macros.model;

import dev.macros.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An ordered command sequence with its label index, global variable seeds and the
 * iteration safety bound. Construction fails with {@link ConfigurationException}
 * unless every reference resolves; the structure is immutable afterwards.
 */
public final class Script {

    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    private final List<Command> sequence;
    private final Map<String, Object> variablesGlobal;
    private final int maxIterations;
    private final Command onErrorHandler;

    private final Map<String, Command> commandsById;
    private final Map<String, String> labelMap;
    private final Map<String, Integer> positions;
    private final Map<String, Expression> expressions;
    private final Map<String, Boolean> enabledOverrides = new ConcurrentHashMap<>();

    public Script(List<Command> sequence, Map<String, Object> variablesGlobal,
                  int maxIterations, Command onErrorHandler) {
        this.sequence = List.copyOf(Objects.requireNonNull(sequence, "sequence"));
        this.variablesGlobal = variablesGlobal == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variablesGlobal));
        this.maxIterations = maxIterations;
        this.onErrorHandler = onErrorHandler;

        List<String> errors = ScriptValidator.validate(this.sequence, onErrorHandler, maxIterations);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }

        var placed = new ArrayList<ScriptValidator.Placed>();
        ScriptValidator.collect(this.sequence, null, placed);
        if (onErrorHandler != null) {
            ScriptValidator.collect(List.of(onErrorHandler), null, placed);
        }
        this.commandsById = Map.copyOf(ScriptValidator.index(placed));

        var labels = new LinkedHashMap<String, String>();
        var compiled = new HashMap<String, Expression>();
        for (ScriptValidator.Placed p : placed) {
            labels.put(p.command().name(), p.command().id());
            for (String source : expressionsOf(p.command().spec())) {
                compiled.computeIfAbsent(source, Expression::parse);
            }
        }
        this.labelMap = Collections.unmodifiableMap(labels);
        this.expressions = Map.copyOf(compiled);

        var index = new HashMap<String, Integer>();
        for (int i = 0; i < this.sequence.size(); i++) {
            index.put(this.sequence.get(i).id(), i);
        }
        this.positions = Map.copyOf(index);
    }

    public Script(List<Command> sequence) {
        this(sequence, Map.of(), DEFAULT_MAX_ITERATIONS, null);
    }

    public List<Command> sequence() { return sequence; }
    public Map<String, Object> variablesGlobal() { return variablesGlobal; }
    public int maxIterations() { return maxIterations; }
    public Command onErrorHandler() { return onErrorHandler; }

    /** Command name to command id, covering every command in the script. */
    public Map<String, String> labelMap() { return labelMap; }

    /** Look up any command (top-level, nested, or the error handler) by id. */
    public Command command(String id) {
        return commandsById.get(id);
    }

    /** Id of the first command, or null for an empty script. */
    public String firstCommandId() {
        return sequence.isEmpty() ? null : sequence.get(0).id();
    }

    /**
     * Id of the top-level command that follows {@code commandId} in document order,
     * or null at the end of the sequence.
     */
    public String naturalNext(String commandId) {
        Integer position = positions.get(commandId);
        if (position == null) {
            throw new IllegalArgumentException("Not a top-level command: " + commandId);
        }
        int next = position + 1;
        return next < sequence.size() ? sequence.get(next).id() : null;
    }

    /**
     * Command id a jump label resolves to, or null if the label is unknown.
     */
    public String resolveLabel(String label) {
        String id = labelMap.get(label);
        return id != null && positions.containsKey(id) ? id : null;
    }

    /** Parsed form of an expression that appears in this script. */
    public Expression expression(String source) {
        Expression expression = expressions.get(source);
        if (expression == null) {
            throw new IllegalArgumentException("Expression not part of this script: " + source);
        }
        return expression;
    }

    public boolean isEnabled(Command command) {
        return enabledOverrides.getOrDefault(command.id(), command.enabled());
    }

    /** Toggle a command while the script may be running. */
    public void setEnabled(String commandId, boolean enabled) {
        if (!commandsById.containsKey(commandId)) {
            throw new IllegalArgumentException("Unknown command id: " + commandId);
        }
        enabledOverrides.put(commandId, enabled);
    }

    /** Copy of the sequence with runtime enable toggles folded into the commands. */
    public List<Command> effectiveSequence() {
        return withOverrides(sequence);
    }

    private List<Command> withOverrides(List<Command> commands) {
        var out = new ArrayList<Command>(commands.size());
        for (Command cmd : commands) {
            Command current = cmd.withEnabled(isEnabled(cmd));
            CommandSpec spec = current.spec();
            if (spec instanceof CommandSpec.Repeat r) {
                spec = new CommandSpec.Repeat(r.count(), r.untilExpr(), withOverrides(r.innerCommands()));
            } else if (spec instanceof CommandSpec.Condition c) {
                spec = new CommandSpec.Condition(c.expr(), c.thenLabel(), c.elseLabel(),
                    withOverrides(c.nestedThen()), withOverrides(c.nestedElse()));
            }
            out.add(new Command(current.id(), current.parentId(), current.name(), current.enabled(),
                current.onFail(), current.variablesOut(), spec));
        }
        return out;
    }

    private static List<String> expressionsOf(CommandSpec spec) {
        if (spec instanceof CommandSpec.Condition c) {
            return List.of(c.expr());
        }
        if (spec instanceof CommandSpec.Goto g && g.guardExpr() != null) {
            return List.of(g.guardExpr());
        }
        if (spec instanceof CommandSpec.Repeat r && r.untilExpr() != null) {
            return List.of(r.untilExpr());
        }
        return List.of();
    }
}
