package com.simpleinterpreter.spi;

public class SyntaxError extends SpiError {
    public final TokenType expected; // null when no single kind was expected
    public final TokenType actual;

    public SyntaxError(Token token, TokenType expected, String message) {
        super(token, message);
        this.expected = expected;
        this.actual = token.type;
    }

    @Override
    public String kind() {
        return "SyntaxError";
    }
}
