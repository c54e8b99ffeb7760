package com.rpal.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    public final int line;

    Token(TokenType type, String lexeme, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
    }

    public TokenType getType() { return type; }

    boolean is(String text) {
        return lexeme.equals(text) && type != TokenType.STRING;
    }

    @Override
    public String toString() {
        return lexeme + " : " + type;
    }
}
