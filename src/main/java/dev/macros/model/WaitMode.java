package dev.macros.model;

/**
 * What a Wait command waits for.
 */
public enum WaitMode {
    TIMEOUT("Timeout"),
    PIXEL_COLOR("PixelColor"),
    SCREEN_CHANGE("ScreenChange");

    private final String label;

    WaitMode(String label) {
        this.label = label;
    }

    /** Name used in the persisted script format. */
    public String label() {
        return label;
    }

    public static WaitMode fromLabel(String label) {
        for (WaitMode value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown WaitMode '%s'".formatted(label));
    }
}
