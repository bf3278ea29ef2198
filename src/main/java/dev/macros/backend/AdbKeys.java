package dev.macros.backend;

import java.util.Locale;
import java.util.Map;

/**
 * Translates script key names ("enter", "ctrl", "a") into Android key codes.
 */
final class AdbKeys {

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("enter", "KEYCODE_ENTER"),
        Map.entry("return", "KEYCODE_ENTER"),
        Map.entry("esc", "KEYCODE_ESCAPE"),
        Map.entry("escape", "KEYCODE_ESCAPE"),
        Map.entry("backspace", "KEYCODE_DEL"),
        Map.entry("delete", "KEYCODE_FORWARD_DEL"),
        Map.entry("del", "KEYCODE_FORWARD_DEL"),
        Map.entry("tab", "KEYCODE_TAB"),
        Map.entry("space", "KEYCODE_SPACE"),
        Map.entry("ctrl", "KEYCODE_CTRL_LEFT"),
        Map.entry("control", "KEYCODE_CTRL_LEFT"),
        Map.entry("alt", "KEYCODE_ALT_LEFT"),
        Map.entry("shift", "KEYCODE_SHIFT_LEFT"),
        Map.entry("up", "KEYCODE_DPAD_UP"),
        Map.entry("down", "KEYCODE_DPAD_DOWN"),
        Map.entry("left", "KEYCODE_DPAD_LEFT"),
        Map.entry("right", "KEYCODE_DPAD_RIGHT"),
        Map.entry("home", "KEYCODE_HOME"),
        Map.entry("back", "KEYCODE_BACK"),
        Map.entry("menu", "KEYCODE_MENU"),
        Map.entry("pageup", "KEYCODE_PAGE_UP"),
        Map.entry("pagedown", "KEYCODE_PAGE_DOWN")
    );

    private AdbKeys() {}

    static String keyCode(String key) {
        String trimmed = key.strip();
        if (trimmed.chars().allMatch(Character::isDigit) && !trimmed.isEmpty()) {
            return trimmed;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.startsWith("KEYCODE_")) {
            return upper;
        }
        String alias = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        return alias != null ? alias : "KEYCODE_" + upper;
    }

    /**
     * Escape text for {@code input text}: spaces become {@code %s}, shell
     * metacharacters get a backslash.
     */
    static String escapeText(String text) {
        var out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case ' ' -> out.append("%s");
                case '\\', '"', '\'', '$', '`', '&', '|', ';', '<', '>', '(', ')', '*', '~', '#', '!', '?', '[', ']', '{', '}' ->
                    out.append('\\').append(c);
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
