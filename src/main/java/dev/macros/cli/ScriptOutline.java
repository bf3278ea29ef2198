package dev.macros.cli;

import dev.macros.model.Command;
import dev.macros.model.CommandSpec;
import dev.macros.model.OnFail;
import dev.macros.model.Script;

import java.util.List;

/**
 * Indented, human-readable view of a script for {@code --dry-run}.
 */
final class ScriptOutline {

    private ScriptOutline() {}

    static String render(Script script) {
        var out = new StringBuilder();
        out.append("maxIterations: ").append(script.maxIterations()).append('\n');
        if (!script.variablesGlobal().isEmpty()) {
            out.append("variables: ").append(script.variablesGlobal()).append('\n');
        }
        appendAll(out, script, script.sequence(), 1);
        if (script.onErrorHandler() != null) {
            out.append("on error:\n");
            append(out, script, script.onErrorHandler(), 1);
        }
        return out.toString();
    }

    private static void appendAll(StringBuilder out, Script script, List<Command> commands, int depth) {
        for (Command command : commands) {
            append(out, script, command, depth);
        }
    }

    private static void append(StringBuilder out, Script script, Command command, int depth) {
        out.append("  ".repeat(depth))
            .append(command.name())
            .append(" [").append(command.kind().label()).append(']');
        if (!script.isEnabled(command)) {
            out.append(" (disabled)");
        }
        String detail = detail(command.spec());
        if (!detail.isEmpty()) {
            out.append(' ').append(detail);
        }
        if (!(command.onFail() instanceof OnFail.Skip)) {
            out.append(" onFail=").append(command.onFail().label());
            if (command.onFail() instanceof OnFail.GotoLabel g) {
                out.append("->").append(g.target());
            }
        }
        out.append('\n');

        if (command.spec() instanceof CommandSpec.Repeat r) {
            appendAll(out, script, r.innerCommands(), depth + 1);
        } else if (command.spec() instanceof CommandSpec.Condition c) {
            if (!c.nestedThen().isEmpty()) {
                out.append("  ".repeat(depth + 1)).append("then:\n");
                appendAll(out, script, c.nestedThen(), depth + 2);
            }
            if (!c.nestedElse().isEmpty()) {
                out.append("  ".repeat(depth + 1)).append("else:\n");
                appendAll(out, script, c.nestedElse(), depth + 2);
            }
        }
    }

    private static String detail(CommandSpec spec) {
        if (spec instanceof CommandSpec.Click c) {
            return "%s at (%d,%d)".formatted(c.button().label(), c.x(), c.y());
        }
        if (spec instanceof CommandSpec.CropImage c) {
            return "%s in %s -> %s".formatted(c.targetColor(), c.region(), c.outputVar());
        }
        if (spec instanceof CommandSpec.KeyPress k) {
            return k.repeat() > 1 ? "%s x%d".formatted(k.key(), k.repeat()) : k.key();
        }
        if (spec instanceof CommandSpec.HotKey h) {
            return String.join("+", h.keys()) + " " + h.order().label();
        }
        if (spec instanceof CommandSpec.Text t) {
            return "%s \"%s\"".formatted(t.mode().label(), t.content());
        }
        if (spec instanceof CommandSpec.Wait w) {
            return "%s %d ms".formatted(w.mode().label(), w.timeout().toMillis());
        }
        if (spec instanceof CommandSpec.Repeat r) {
            String times = r.count() == 0 ? "unbounded" : r.count() + "x";
            return r.untilExpr() == null ? times : times + " until " + r.untilExpr();
        }
        if (spec instanceof CommandSpec.Goto g) {
            return g.guardExpr() == null ? "-> " + g.targetLabel() : "-> %s if %s".formatted(g.targetLabel(), g.guardExpr());
        }
        if (spec instanceof CommandSpec.Condition c) {
            var s = new StringBuilder(c.expr());
            if (c.thenLabel() != null) {
                s.append(" then -> ").append(c.thenLabel());
            }
            if (c.elseLabel() != null) {
                s.append(" else -> ").append(c.elseLabel());
            }
            return s.toString();
        }
        return "";
    }
}
