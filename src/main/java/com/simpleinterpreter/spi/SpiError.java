package com.simpleinterpreter.spi;

/**
 * Base class of every error that aborts a translation. The line is the
 * source line the error was detected on, or 0 when it isn't known.
 */
public abstract class SpiError extends RuntimeException {
    public final int line;
    public final Token token;

    SpiError(int line, String message) {
        super(message);
        this.line = line;
        this.token = null;
    }

    SpiError(Token token, String message) {
        super(message);
        this.line = token == null ? 0 : token.line;
        this.token = token;
    }

    public abstract String kind();
}
