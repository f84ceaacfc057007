package com.lambdacalc.engine.parser;

import java.util.List;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.Application;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Expr.Variable;

/**
 * Recursive-descent parser for lambda terms.
 *
 * <pre>
 *   expr := abs | app
 *   abs  := 'λ' name '.' expr
 *   app  := atom atom*          (left-associative, stops at EOF, ')' or '.')
 *   atom := '(' expr ')' | NUMBER | name
 * </pre>
 *
 * A {@code λ} cannot start an atom, so {@code f λx.x} is rejected; the
 * abstraction has to be parenthesized when it is an argument.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Convenience: tokenize and parse in one go. */
    public static ExprInterface parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public ExprInterface parse() {
        ExprInterface expr = expression();
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected '" + peek().lexeme + "'");
        }
        return expr;
    }

    private ExprInterface expression() {
        if (match(TokenType.LAMBDA)) return abstraction();
        return application();
    }

    private ExprInterface abstraction() {
        String param = name();
        consume(TokenType.DOT, "Expected '.' after λ parameter");
        ExprInterface body = expression();
        return new Abstraction(param, body);
    }

    private ExprInterface application() {
        ExprInterface expr = atom();
        while (!isAtEnd() && !check(TokenType.RIGHT_PAREN) && !check(TokenType.DOT)) {
            expr = new Application(expr, atom());
        }
        return expr;
    }

    private ExprInterface atom() {
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')'");
            return expr;
        }
        if (match(TokenType.NUMBER)) {
            return ChurchNumerals.church((Integer) previous().literal);
        }
        return new Variable(name());
    }

    /**
     * Reads a variable name. The lexer hands binders over as identifiers even
     * when they start with digits ({@code λ1.1}); in atom position a digit run
     * is a numeral and never reaches here.
     */
    private String name() {
        if (match(TokenType.IDENTIFIER)) return previous().lexeme;
        throw error(peek(), "Invalid variable start '" + peek().lexeme + "'");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        return new ParseError(message, token.lexeme, token.offset);
    }
}
