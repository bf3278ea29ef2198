package dev.macros.capture;

/**
 * Where a color search hit, in frame pixels, and how close the color was (0-1).
 */
public record ColorMatch(int x, int y, double confidence) {}
