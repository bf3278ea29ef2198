package dev.macros.backend;

import dev.macros.coords.Point;
import dev.macros.model.TextMode;

/**
 * Text entry, optionally preceded by a tap on {@code focus} (nullable, physical).
 */
public record TextAction(String content, TextMode mode, int speedMinCps, int speedMaxCps, Point focus) {}
