package com.nova.debug;

import java.io.PrintStream;

/** One {@code [LEVEL] tag: message} line per record, stack trace after errors. */
public final class StdErrDebugSink implements DebugSink {

    private final PrintStream out;

    public StdErrDebugSink() {
        this(System.err);
    }

    public StdErrDebugSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        out.println("[" + level + "] " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}
