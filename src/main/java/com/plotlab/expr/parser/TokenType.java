package com.plotlab.expr.parser;

public enum TokenType {
    NUMBER,
    IDENTIFIER,

    PLUS,
    MINUS,
    STAR,
    DOUBLE_STAR,
    SLASH,
    PERCENT,

    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,

    EOF
}
