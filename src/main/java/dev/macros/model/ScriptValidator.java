package dev.macros.model;

import dev.macros.expr.Expression;
import dev.macros.expr.ExpressionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a script's cross-references before it can run. Field ranges are already
 * enforced by the command records; this checks what only the whole script can tell.
 */
public final class ScriptValidator {

    private ScriptValidator() {}

    /**
     * Validate a script definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(List<Command> sequence, Command onErrorHandler, int maxIterations) {
        var errors = new ArrayList<String>();

        if (maxIterations < 1) {
            errors.add("maxIterations must be at least 1: " + maxIterations);
        }

        var all = new ArrayList<Placed>();
        collect(sequence, null, all);
        if (onErrorHandler != null) {
            collect(List.of(onErrorHandler), null, all);
        }

        var topLevel = new HashSet<String>();
        sequence.forEach(c -> topLevel.add(c.name()));

        // Rule 1: ids and names are unique script-wide
        var ids = new HashSet<String>();
        var names = new HashMap<String, Integer>();
        for (Placed placed : all) {
            if (!ids.add(placed.command().id())) {
                errors.add("Duplicate command id '%s'".formatted(placed.command().id()));
            }
            names.merge(placed.command().name(), 1, Integer::sum);
        }
        names.forEach((name, count) -> {
            if (count > 1) {
                errors.add("Duplicate command name '%s' (%d commands)".formatted(name, count));
            }
        });

        for (Placed placed : all) {
            Command cmd = placed.command();

            // Rule 2: parentId names the enclosing Repeat/Condition
            if (cmd.parentId() != null && !cmd.parentId().equals(placed.enclosingId())) {
                errors.add(placed.enclosingId() == null
                    ? "Command '%s': parentId '%s' but the command is not nested".formatted(cmd.name(), cmd.parentId())
                    : "Command '%s': parentId '%s' does not match enclosing command '%s'"
                        .formatted(cmd.name(), cmd.parentId(), placed.enclosingId()));
            }

            // Rule 3: every label resolves to a top-level command
            if (cmd.onFail() instanceof OnFail.GotoLabel gotoLabel) {
                checkLabel(errors, cmd, "onFail label", gotoLabel.target(), topLevel, names.keySet());
            }
            CommandSpec spec = cmd.spec();
            if (spec instanceof CommandSpec.Goto gotoSpec) {
                checkLabel(errors, cmd, "Goto target", gotoSpec.targetLabel(), topLevel, names.keySet());
                checkExpression(errors, cmd, "guard", gotoSpec.guardExpr());
            } else if (spec instanceof CommandSpec.Condition condition) {
                if (condition.thenLabel() != null) {
                    checkLabel(errors, cmd, "then label", condition.thenLabel(), topLevel, names.keySet());
                }
                if (condition.elseLabel() != null) {
                    checkLabel(errors, cmd, "else label", condition.elseLabel(), topLevel, names.keySet());
                }
                checkExpression(errors, cmd, "expression", condition.expr());
            } else if (spec instanceof CommandSpec.Repeat repeat) {
                checkExpression(errors, cmd, "until-condition", repeat.untilExpr());
            }
        }

        return errors;
    }

    private static void checkLabel(List<String> errors, Command cmd, String role, String label,
                                   Set<String> topLevel, Set<String> allNames) {
        if (topLevel.contains(label)) {
            return;
        }
        if (allNames.contains(label)) {
            errors.add("Command '%s': %s '%s' names a nested command".formatted(cmd.name(), role, label));
        } else {
            errors.add("Command '%s': %s '%s' not found".formatted(cmd.name(), role, label));
        }
    }

    private static void checkExpression(List<String> errors, Command cmd, String role, String source) {
        if (source == null) {
            return;
        }
        try {
            Expression.parse(source);
        } catch (ExpressionException e) {
            errors.add("Command '%s': invalid %s '%s': %s".formatted(cmd.name(), role, source, e.getMessage()));
        }
    }

    static void collect(List<Command> commands, String enclosingId, List<Placed> out) {
        for (Command cmd : commands) {
            out.add(new Placed(cmd, enclosingId));
            for (List<Command> children : cmd.children()) {
                collect(children, cmd.id(), out);
            }
        }
    }

    /** A command together with the id of the command that owns it (null at top level). */
    record Placed(Command command, String enclosingId) {}

    static Map<String, Command> index(List<Placed> placed) {
        var byId = new HashMap<String, Command>();
        placed.forEach(p -> byId.putIfAbsent(p.command().id(), p.command()));
        return byId;
    }
}
