package com.nova.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Prompts on stdout and waits for Enter on stdin. End of input counts as acknowledgment. */
public final class ConsoleAcknowledgmentSource implements AcknowledgmentSource {

    static final String PROMPT = "Paused. Press Enter to continue...";

    private final BufferedReader in;
    private final PrintStream out;

    private static final class StdinHolder {
        static final ConsoleAcknowledgmentSource INSTANCE = new ConsoleAcknowledgmentSource(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    /**
     * The source over the process's stdin. Created on first use and shared, so every engine
     * reads through one buffer and no reader holds lines another is waiting for.
     */
    public static ConsoleAcknowledgmentSource stdin() {
        return StdinHolder.INSTANCE;
    }

    public ConsoleAcknowledgmentSource(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public void waitForAck() {
        out.print(PROMPT);
        out.flush();
        try {
            in.readLine(); // blocks
        } catch (IOException e) {
            throw new UncheckedIOException("pause could not read from stdin", e);
        }
    }
}
