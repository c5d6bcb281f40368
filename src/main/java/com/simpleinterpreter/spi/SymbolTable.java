package com.simpleinterpreter.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names declared by a program. There is a single, global scope: the
 * language has no procedures.
 */
public class SymbolTable {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    public final String scopeName;
    public final int scopeLevel;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final boolean verbose;

    public SymbolTable(String scopeName, int scopeLevel, boolean verbose) {
        this.scopeName = scopeName;
        this.scopeLevel = scopeLevel;
        this.verbose = verbose;
        define(new Symbol.BuiltinType("INTEGER"));
        define(new Symbol.BuiltinType("REAL"));
    }

    public void define(Symbol symbol) {
        trace("Define: {}", symbol);
        String key = key(symbol.name);
        if (symbols.containsKey(key)) {
            throw new IllegalStateException("symbol already defined: " + symbol.name);
        }
        symbols.put(key, symbol);
    }

    // returns null if the name isn't defined
    public Symbol lookup(String name) {
        trace("Lookup: {}", name);
        return symbols.get(key(name));
    }

    public Map<String, Symbol> symbols() {
        return Collections.unmodifiableMap(symbols);
    }

    private void trace(String format, Object arg) {
        if (verbose) {
            LOG.info(format, arg);
        } else {
            LOG.debug(format, arg);
        }
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("Scope name: ").append(scopeName).append("\n");
        builder.append("Scope level: ").append(scopeLevel).append("\n");
        for (Symbol symbol : symbols.values()) {
            builder.append(String.format("%10s: %s", symbol.name, symbol)).append("\n");
        }
        return builder.toString();
    }
}
