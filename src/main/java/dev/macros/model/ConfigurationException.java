package dev.macros.model;

import java.util.List;

/**
 * A script or command definition that can never run: duplicate names, unresolved
 * labels, out-of-range fields. Raised at construction, never handled by OnFail.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(List<String> errors) {
        super(errors.size() == 1
            ? errors.get(0)
            : "%d configuration errors: %s".formatted(errors.size(), String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> errors() {
        return errors;
    }
}
