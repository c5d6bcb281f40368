package com.simpleinterpreter.spi;

public class ArithmeticError extends SpiError {
    public ArithmeticError(Token operator, String message) {
        super(operator, message);
    }

    @Override
    public String kind() {
        return "ArithmeticError";
    }
}
