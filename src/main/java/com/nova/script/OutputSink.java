package com.nova.script;

/** Where {@code put}/{@code print} lines go. */
@FunctionalInterface
public interface OutputSink {
    void println(String line);

    static OutputSink stdout() {
        return System.out::println;
    }
}
