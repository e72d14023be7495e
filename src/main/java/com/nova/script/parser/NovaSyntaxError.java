package com.nova.script.parser;

/** Lexing or parsing failure. No partial program is ever produced alongside one. */
public abstract class NovaSyntaxError extends NovaException {
    private final int line;
    private final int column;

    protected NovaSyntaxError(int line, int column, String message) {
        super("[line " + line + ":" + column + "] " + message);
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }
    public int column() { return column; }
}
