package com.nova.script;

/**
 * Host hook for script failures. When installed on {@link NovaScript}, failures are
 * reported here and not rethrown.
 */
public interface NovaErrorListener {
    /**
     * @param phase   {@code "parse"}, {@code "run"} or {@code "compile"}
     * @param error   the failure as raised by the lexer, parser, interpreter or generator
     */
    void onError(String phase, RuntimeException error);
}
