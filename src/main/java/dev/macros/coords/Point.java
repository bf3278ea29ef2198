package dev.macros.coords;

public record Point(int x, int y) {}
