package dev.macros.model;

/**
 * Whether a HotKey presses its keys together or one after another.
 */
public enum HotKeyOrder {
    SIMULTANEOUS("Simultaneous"),
    SEQUENCE("Sequence");

    private final String label;

    HotKeyOrder(String label) {
        this.label = label;
    }

    /** Name used in the persisted script format. */
    public String label() {
        return label;
    }

    public static HotKeyOrder fromLabel(String label) {
        for (HotKeyOrder value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown HotKeyOrder '%s'".formatted(label));
    }
}
