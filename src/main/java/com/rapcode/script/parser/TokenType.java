package com.rapcode.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens.
    ASSIGN,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals.
    IDENTIFIER, STRING, NUMBER,

    // Keywords.
    SET, IF, THEN, ELSE, ENDIF,
    LOOP, WHILE, DO, ENDLOOP, BREAK,
    OUTPUT, INPUT, TRUE, FALSE, NOT,

    EOF
}
