package com.lambdacalc.engine.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits lambda source text into tokens.
 *
 * Every character is either whitespace, one of the four delimiters
 * ({@code λ . ( )}), or part of a name. The name right after a {@code λ} is
 * always an identifier; elsewhere a leading digit run is a numeric literal,
 * and a literal that does not fit in an int is the only way scanning fails.
 */
public class Lexer {
    public static final char LAMBDA = 'λ';

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private boolean binderNext = false;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case LAMBDA: addToken(TokenType.LAMBDA); binderNext = true; break;
            case '.': addToken(TokenType.DOT); binderNext = false; break;
            case '(': addToken(TokenType.LEFT_PAREN); binderNext = false; break;
            case ')': addToken(TokenType.RIGHT_PAREN); binderNext = false; break;
            default:
                if (Character.isWhitespace(c)) break;
                // a binder is always a name, digits included: λ1x.y binds "1x"
                if (binderNext) {
                    binderNext = false;
                    identifier();
                } else if (isDigit(c)) {
                    number();
                } else {
                    identifier();
                }
        }
    }

    private void identifier() {
        while (isNameChar(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ParseError("Numeral too large", text, start);
        }
        addToken(TokenType.NUMBER, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    /** True for any character that may appear in a variable name. */
    public static boolean isNameChar(char c) {
        if (c == '\0') return false;
        if (Character.isWhitespace(c)) return false;
        return c != '(' && c != ')' && c != '.' && c != LAMBDA;
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }
}
