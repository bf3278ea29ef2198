package dev.macros.model;

import java.util.List;
import java.util.UUID;

/**
 * One script step. {@code name} is unique script-wide and doubles as the jump label;
 * {@code enabled} is the persisted initial value (see {@link Script#isEnabled}).
 */
public record Command(
    String id,
    String parentId, // nullable; id of the enclosing Repeat/Condition
    String name,
    boolean enabled,
    OnFail onFail,
    List<String> variablesOut,
    CommandSpec spec
) {
    public Command {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Command id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Command '%s' has missing or empty name".formatted(id));
        }
        if (spec == null) {
            throw new ConfigurationException("Command '%s' has no variant".formatted(name));
        }
        onFail = onFail == null ? OnFail.SKIP : onFail;
        variablesOut = variablesOut == null ? List.of() : List.copyOf(variablesOut);
    }

    /** Enabled command with a fresh id, OnFail=Skip and no outputs. */
    public static Command of(String name, CommandSpec spec) {
        return new Command(UUID.randomUUID().toString(), null, name, true, OnFail.SKIP, List.of(), spec);
    }

    public CommandKind kind() {
        return spec.kind();
    }

    public Command withParentId(String newParentId) {
        return new Command(id, newParentId, name, enabled, onFail, variablesOut, spec);
    }

    public Command withEnabled(boolean newEnabled) {
        return new Command(id, parentId, name, newEnabled, onFail, variablesOut, spec);
    }

    public Command withOnFail(OnFail newOnFail) {
        return new Command(id, parentId, name, enabled, newOnFail, variablesOut, spec);
    }

    public Command withVariablesOut(List<String> newVariablesOut) {
        return new Command(id, parentId, name, enabled, onFail, newVariablesOut, spec);
    }

    /** Child command lists owned by this command, in document order. */
    public List<List<Command>> children() {
        if (spec instanceof CommandSpec.Repeat repeat) {
            return List.of(repeat.innerCommands());
        }
        if (spec instanceof CommandSpec.Condition condition) {
            return List.of(condition.nestedThen(), condition.nestedElse());
        }
        return List.of();
    }
}
