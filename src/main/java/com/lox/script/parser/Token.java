package com.lox.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    public final int line;

    Token(TokenType type, String lexeme, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' (line " + line + ")";
    }
}
