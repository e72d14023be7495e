package com.nova.script.parser;

public final class UnexpectedEndOfInput extends NovaSyntaxError {
    private final String expected;

    UnexpectedEndOfInput(int line, int column, String expected) {
        super(line, column, "Unexpected end of input, expected " + expected);
        this.expected = expected;
    }

    public String expected() { return expected; }
}
