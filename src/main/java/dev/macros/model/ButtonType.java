package dev.macros.model;

/**
 * Mouse button (or wheel direction) used by a Click.
 */
public enum ButtonType {
    LEFT("Left"),
    RIGHT("Right"),
    DOUBLE("Double"),
    WHEEL_UP("WheelUp"),
    WHEEL_DOWN("WheelDown");

    private final String label;

    ButtonType(String label) {
        this.label = label;
    }

    /** Name used in the persisted script format. */
    public String label() {
        return label;
    }

    public static ButtonType fromLabel(String label) {
        for (ButtonType value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown ButtonType '%s'".formatted(label));
    }
}
