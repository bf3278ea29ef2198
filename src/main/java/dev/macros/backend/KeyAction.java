package dev.macros.backend;

public record KeyAction(String key, int repeat, int delayBetweenMs) {}
