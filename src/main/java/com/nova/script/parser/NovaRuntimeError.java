package com.nova.script.parser;

/** Fatal evaluation failure. The run stops at the statement that raised it. */
public final class NovaRuntimeError extends NovaException {

    public enum Kind {
        DIVISION_BY_ZERO,
        UNDEFINED_BEHAVIOR
    }

    private final Kind kind;
    private final int line;

    NovaRuntimeError(Kind kind, int line, String message) {
        super("[line " + line + "] " + message);
        this.kind = kind;
        this.line = line;
    }

    public Kind kind() { return kind; }
    public int line() { return line; }
}
