package com.rapcode.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable memory of one interpreter run. Rapcode has no nested scopes, so this is a
 * single flat map; assignment creates or overwrites, reading an unknown name is a NAME error.
 */
public class Environment {
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {}

    public Environment(Map<String, Value> initial) {
        if (initial != null) values.putAll(initial);
    }

    public void assign(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name, Token at) {
        Value v = values.get(name);
        if (v == null) {
            throw new RapcodeException(ErrorKind.NAME, "Variable '" + name + "' is not defined.", at);
        }
        return v;
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    /** Read-only view in assignment order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
