package com.simpleinterpreter.spi;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Variable bindings of one interpretation run. Pascal identifiers are not
 * case-sensitive, so neither are the keys.
 */
public class Environment {
    private final Map<String, Number> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public void define(String name, Number value) {
        values.put(name, value);
    }

    public void assign(Token name, Number value) {
        define(name.lexeme, value);
    }

    public Number get(Token name) {
        Number value = values.get(name.lexeme);
        if (value == null) {
            throw new NameError(name, "Undefined variable '" + name.lexeme + "'.");
        }
        return value;
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    public Map<String, Number> values() {
        return Collections.unmodifiableMap(values);
    }
}
