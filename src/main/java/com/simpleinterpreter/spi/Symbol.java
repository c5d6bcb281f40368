package com.simpleinterpreter.spi;

public abstract class Symbol {
    public final String name;

    Symbol(String name) {
        this.name = name;
    }

    public static final class BuiltinType extends Symbol {
        public BuiltinType(String name) {
            super(name);
        }

        public String toString() {
            return name;
        }
    }

    public static final class Variable extends Symbol {
        public final Symbol type;

        public Variable(String name, Symbol type) {
            super(name);
            this.type = type;
        }

        public String toString() {
            return "<" + name + ":" + type.name + ">";
        }
    }
}
