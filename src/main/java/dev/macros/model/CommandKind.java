package dev.macros.model;

/**
 * Variant tag of a command. Actions produce an external effect through the device
 * collaborator; logic commands are evaluated in-process and steer the cursor.
 */
public enum CommandKind {
    CLICK("Click", true),
    CROP_IMAGE("CropImage", true),
    KEY_PRESS("KeyPress", true),
    HOT_KEY("HotKey", true),
    TEXT("Text", true),
    WAIT("Wait", false),
    REPEAT("Repeat", false),
    GOTO("Goto", false),
    CONDITION("Condition", false);

    private final String label;
    private final boolean action;

    CommandKind(String label, boolean action) {
        this.label = label;
        this.action = action;
    }

    public String label() {
        return label;
    }

    public boolean isAction() {
        return action;
    }

    public static CommandKind fromLabel(String label) {
        for (CommandKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unknown command type '%s'".formatted(label));
    }
}
