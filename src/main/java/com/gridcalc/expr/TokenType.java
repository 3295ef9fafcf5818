package com.gridcalc.expr;

public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    IDENTIFIER,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    POWER,
    AMPERSAND,

    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,

    LPAREN,
    RPAREN,
    COMMA,
    COLON,

    EOF
}
