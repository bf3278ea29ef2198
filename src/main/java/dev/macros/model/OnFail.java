package dev.macros.model;

/**
 * What the run loop does after a command fails.
 * Exactly one of three forms: skip to the next command, stop the run, or jump to a label.
 */
public sealed interface OnFail {

    Skip SKIP = new Skip();
    Stop STOP = new Stop();

    /** Persisted name: Skip, Stop or GotoLabel. */
    String label();

    /** Continue with the command that naturally follows. */
    record Skip() implements OnFail {
        @Override
        public String label() { return "Skip"; }
    }

    /** End the run as Failed. */
    record Stop() implements OnFail {
        @Override
        public String label() { return "Stop"; }
    }

    /** Move the cursor to the command named {@code label}. */
    record GotoLabel(String target) implements OnFail {
        public GotoLabel {
            if (target == null || target.isBlank()) {
                throw new ConfigurationException("OnFail GotoLabel requires a label");
            }
        }

        @Override
        public String label() { return "GotoLabel"; }
    }

    static OnFail gotoLabel(String target) {
        return new GotoLabel(target);
    }

    /**
     * Rebuild a policy from its persisted form.
     */
    static OnFail of(String label, String target) {
        return switch (label) {
            case "Skip" -> SKIP;
            case "Stop" -> STOP;
            case "GotoLabel" -> new GotoLabel(target);
            default -> throw new ConfigurationException("Unknown onFail '%s'".formatted(label));
        };
    }
}
