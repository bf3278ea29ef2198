package dev.macros.model;

/**
 * Whether a Text command pastes its content at once or types it at a human pace.
 */
public enum TextMode {
    PASTE("Paste"),
    HUMANIZE("Humanize");

    private final String label;

    TextMode(String label) {
        this.label = label;
    }

    /** Name used in the persisted script format. */
    public String label() {
        return label;
    }

    public static TextMode fromLabel(String label) {
        for (TextMode value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown TextMode '%s'".formatted(label));
    }
}
