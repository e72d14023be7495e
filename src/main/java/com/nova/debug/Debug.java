package com.nova.debug;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Process-wide log hub for the lexer, parser, interpreter, generator and build host.
 *
 * Components log through {@code Debug.get().d(TAG, ...)}. Nothing is written until a
 * host installs a sink; records below the installed level never reach it.
 */
public final class Debug {

    private static final DebugSink DISCARD = (level, tag, message, error) -> {
        // no sink installed
    };

    // Must follow DISCARD: the constructor reads it.
    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(DISCARD);
    private volatile DebugLevel level = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code sink} and drops every record below {@code threshold}. */
    public void install(DebugSink sink, DebugLevel threshold) {
        setSink(sink);
        this.level = (threshold == null) ? DebugLevel.TRACE : threshold;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? DISCARD : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public DebugLevel getLevel() {
        return level;
    }

    /** Back to the silent default: no sink, every level passed through. */
    public void reset() {
        install(null, DebugLevel.TRACE);
    }

    public boolean isEnabled(DebugLevel candidate) {
        return sinkRef.get() != DISCARD && candidate.atLeast(level);
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }

    /** Trace with a message built only when tracing is on. */
    public void t(String tag, Supplier<String> msg) {
        if (isEnabled(DebugLevel.TRACE)) log(DebugLevel.TRACE, tag, msg.get(), null);
    }

    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel at, String tag, String message, Throwable error) {
        if (!at.atLeast(level)) return;
        sinkRef.get().log(at, tag, message, error);
    }
}
