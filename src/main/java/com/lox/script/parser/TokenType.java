package com.lox.script.parser;

public enum TokenType {
    // single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, SEMICOLON, QUESTION,
    PLUS, MINUS, STAR, SLASH,

    // one or two character tokens
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // literals
    IDENTIFIER, STRING, NUMBER,

    // keywords
    AND, OR, CLASS, ELSE, FALSE, FUN, FOR, IF, NIL,
    PRINT, RETURN, SUPER, THIS, TRUE, VAR, WHILE,

    EOF
}
