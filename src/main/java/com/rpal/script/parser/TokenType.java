package com.rpal.script.parser;

public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    INTEGER,
    STRING,
    OPERATOR,
    PUNCTUATION,
    EOF
}
