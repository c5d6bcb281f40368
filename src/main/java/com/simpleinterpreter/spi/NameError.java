package com.simpleinterpreter.spi;

public class NameError extends SpiError {
    public NameError(Token name, String message) {
        super(name, message);
    }

    @Override
    public String kind() {
        return "NameError";
    }
}
