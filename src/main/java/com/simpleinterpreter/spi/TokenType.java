package com.simpleinterpreter.spi;

public enum TokenType {
    // Literals.
    INTEGER_CONST, REAL_CONST, ID,

    // Operators.
    PLUS, MINUS, MULTIPLY, INTEGER_DIVIDE, FLOAT_DIVIDE, ASSIGN,

    // Punctuation.
    LPAREN, RPAREN, SEMI, COLON, COMMA, DOT,

    // Keywords.
    PROGRAM, VAR, BEGIN, END, INTEGER, REAL,

    EOF
}
