package com.nova.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single, flat variable scope of one interpreter run.
 *
 * There is no block scoping and no shadowing: declaring a name that already exists
 * overwrites it, and assigning to an unknown name declares it.
 */
public class Environment {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {}

    public Environment(Map<String, Value> initial) {
        if (initial != null) values.putAll(initial);
    }

    public void define(String name, Value value) {
        values.put(name, value == null ? Value.unset() : value);
    }

    public void assign(String name, Value value) {
        define(name, value);
    }

    /** Returns the bound value, or null when the name was never declared. */
    public Value get(String name) {
        return values.get(name);
    }

    /** Read-only view in declaration order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
