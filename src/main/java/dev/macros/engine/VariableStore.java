package dev.macros.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A worker's variables. Written by the worker thread, readable from any thread.
 * Null values are allowed and distinct from absent keys.
 */
public final class VariableStore {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public VariableStore(Map<String, Object> seed) {
        if (seed != null) {
            values.putAll(seed);
        }
    }

    public synchronized Object get(String name) {
        return values.get(name);
    }

    public synchronized boolean contains(String name) {
        return values.containsKey(name);
    }

    public synchronized void put(String name, Object value) {
        values.put(name, value);
    }

    public synchronized void remove(String name) {
        values.remove(name);
    }

    /** Immutable copy of the current values, in insertion order. */
    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public synchronized String toString() {
        return values.toString();
    }
}
