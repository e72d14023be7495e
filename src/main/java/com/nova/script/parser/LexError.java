package com.nova.script.parser;

public final class LexError extends NovaSyntaxError {
    private final int position;
    private final char character;

    LexError(int position, int line, int column, char character, String message) {
        super(line, column, message);
        this.position = position;
        this.character = character;
    }

    /** Zero-based offset of the offending character in the source. */
    public int position() { return position; }

    public char character() { return character; }
}
