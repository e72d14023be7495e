package com.nova.script.parser;

/** Root of every failure raised while lexing, parsing or running a Nova program. */
public class NovaException extends RuntimeException {

    public NovaException(String message) {
        super(message);
    }

    public NovaException(String message, Throwable cause) {
        super(message, cause);
    }
}
