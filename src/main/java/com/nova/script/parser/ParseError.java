package com.nova.script.parser;

public final class ParseError extends NovaSyntaxError {
    private final String expected;
    private final Token found;

    ParseError(String expected, Token found, String message) {
        super(found.line, found.column, message);
        this.expected = expected;
        this.found = found;
    }

    /** What the parser was looking for, e.g. {@code ')'} or {@code "expression"}. */
    public String expected() { return expected; }

    public Token found() { return found; }
}
