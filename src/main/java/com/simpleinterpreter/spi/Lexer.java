package com.simpleinterpreter.spi;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.simpleinterpreter.spi.TokenType.*;

/**
 * Turns source text into tokens, one token per call to {@link #nextToken()}.
 * The lexer makes a single pass over its input; once the input is exhausted
 * every further call returns an EOF token.
 */
public class Lexer {
    private final String source;

    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("PROGRAM", PROGRAM);
        keywords.put("VAR",     VAR);
        keywords.put("BEGIN",   BEGIN);
        keywords.put("END",     END);
        keywords.put("INTEGER", INTEGER);
        keywords.put("REAL",    REAL);
        keywords.put("DIV",     INTEGER_DIVIDE);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public Token nextToken() {
        skipWhitespaceAndComments();
        start = current;
        if (isAtEnd()) {
            return new Token(EOF, "", null, line);
        }

        char c = advance();
        if (SpiUtil.isDigit(c)) {
            return number();
        }
        switch (c) {
            case ':':
                if (match('=')) return makeToken(ASSIGN);
                return makeToken(COLON);
            case '+': return makeToken(PLUS);
            case '-': return makeToken(MINUS);
            case '*': return makeToken(MULTIPLY);
            case '/': return makeToken(FLOAT_DIVIDE);
            case '(': return makeToken(LPAREN);
            case ')': return makeToken(RPAREN);
            case ';': return makeToken(SEMI);
            case ',': return makeToken(COMMA);
            case '.': return makeToken(DOT);
            default:
                if (SpiUtil.isAlpha(c)) {
                    return identifier();
                }
                throw new LexicalError(line, "Unexpected character '" + c +
                        "' in: " + source.substring(start));
        }
    }

    // Drains the lexer. The returned list always ends with the EOF token.
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token tok;
        do {
            tok = nextToken();
            tokens.add(tok);
        } while (tok.type != EOF);
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                line++;
                advance();
            } else if (SpiUtil.isWhitespace(c)) {
                advance();
            } else if (c == '{') {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        int startLine = line;
        int commentStart = current;
        advance(); // the {
        while (!isAtEnd() && peek() != '}') {
            if (peek() == '\n') line++;
            advance();
        }
        if (isAtEnd()) {
            throw new LexicalError(startLine, "Unterminated comment: " +
                    source.substring(commentStart));
        }
        advance(); // the }
    }

    private Token number() {
        while (SpiUtil.isDigit(peek())) advance();

        // a real needs digits on both sides of the "."
        if (peek() == '.' && SpiUtil.isDigit(peekNext())) {
            advance();
            while (SpiUtil.isDigit(peek())) advance();
            String text = source.substring(start, current);
            return new Token(REAL_CONST, text, Double.parseDouble(text), line);
        }

        String text = source.substring(start, current);
        try {
            return new Token(INTEGER_CONST, text, Integer.parseInt(text), line);
        } catch (NumberFormatException e) {
            throw new LexicalError(line, "Integer literal out of range: " + text);
        }
    }

    private Token identifier() {
        while (SpiUtil.isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType ttype = keywords.get(text.toUpperCase(Locale.ROOT));
        if (ttype == null) {
            ttype = ID;
        }
        return makeToken(ttype);
    }

    private Token makeToken(TokenType ttype) {
        return new Token(ttype, source.substring(start, current), null, line);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        current++;
        return source.charAt(current-1);
    }

    private boolean match(char c) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != c) return false;
        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        } else {
            return source.charAt(current);
        }
    }

    private char peekNext() {
        if ((current + 1) >= source.length()) {
            return '\0';
        } else {
            return source.charAt(current+1);
        }
    }
}
