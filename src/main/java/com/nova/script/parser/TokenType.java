package com.nova.script.parser;

public enum TokenType {
    NUMBER,
    TEXT,
    IDENTIFIER,
    OPERATOR,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_PAREN,
    RIGHT_PAREN,
    SEMICOLON,
    COMMA,
    DOT
}
