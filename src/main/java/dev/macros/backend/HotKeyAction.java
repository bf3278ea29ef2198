package dev.macros.backend;

import dev.macros.model.HotKeyOrder;

import java.util.List;

public record HotKeyAction(List<String> keys, HotKeyOrder order) {}
