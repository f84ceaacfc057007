package com.lambdacalc.engine.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    /** Character offset of the first character of the lexeme in the source. */
    public final int offset;

    Token(TokenType type, String lexeme, Object literal, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.offset = offset;
    }

    public TokenType type() { return type; }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + offset;
    }
}
