package com.simpleinterpreter.spi;

public class LexicalError extends SpiError {
    public LexicalError(int line, String message) {
        super(line, message);
    }

    @Override
    public String kind() {
        return "LexicalError";
    }
}
