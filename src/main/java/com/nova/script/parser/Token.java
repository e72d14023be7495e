package com.nova.script.parser;

public final class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;
    public final int offset;

    Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /** Offset just past the last source character of this token. */
    public int end() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    public String position() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")";
    }
}
