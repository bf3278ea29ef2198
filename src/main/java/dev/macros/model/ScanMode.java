package dev.macros.model;

/**
 * How a CropImage walks its region looking for the target color.
 */
public enum ScanMode {
    EXACT("Exact"),
    MAX_MATCH("MaxMatch"),
    GRID("Grid");

    private final String label;

    ScanMode(String label) {
        this.label = label;
    }

    /** Name used in the persisted script format. */
    public String label() {
        return label;
    }

    public static ScanMode fromLabel(String label) {
        for (ScanMode value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new ConfigurationException("Unknown ScanMode '%s'".formatted(label));
    }
}
