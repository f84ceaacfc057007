package com.lambdacalc.engine.parser;

public enum TokenType {
    LAMBDA,
    DOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    NUMBER,
    IDENTIFIER,
    EOF
}
