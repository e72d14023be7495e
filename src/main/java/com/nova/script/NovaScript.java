package com.nova.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.nova.debug.Debug;
import com.nova.script.codegen.CSharpGenerator;
import com.nova.script.codegen.GenerationResult;
import com.nova.script.parser.Environment;
import com.nova.script.parser.Interpreter;
import com.nova.script.parser.Lexer;
import com.nova.script.parser.Parser;
import com.nova.script.parser.Statement.Stmt;
import com.nova.script.parser.Token;
import com.nova.script.parser.Value;

/**
 * Entry point for hosts. One front end (lexer and parser) feeds either the
 * interpreter ({@link #run}) or the C# generator ({@link #compile}).
 *
 * Error policy: without a {@link NovaErrorListener} every failure propagates to the
 * caller. With one, the failure is reported and suppressed.
 */
public class NovaScript {
    private static final String TAG = "NovaScript";

    private OutputSink output = OutputSink.stdout();
    private AcknowledgmentSource acknowledgment = null; // null: the shared stdin source
    private String defaultClassName = CSharpGenerator.DEFAULT_CLASS_NAME;
    private NovaErrorListener errorListener = null;

    private final CSharpGenerator generator = new CSharpGenerator();

    public NovaScript() {}

    public void setOutput(OutputSink output) {
        this.output = (output == null) ? OutputSink.stdout() : output;
    }

    public void setAcknowledgment(AcknowledgmentSource acknowledgment) {
        this.acknowledgment = acknowledgment;
    }

    public AcknowledgmentSource getAcknowledgment() {
        return (acknowledgment == null) ? ConsoleAcknowledgmentSource.stdin() : acknowledgment;
    }

    public void setDefaultClassName(String className) {
        this.defaultClassName = (className == null || className.trim().isEmpty())
                ? CSharpGenerator.DEFAULT_CLASS_NAME
                : className.trim();
    }

    public String getDefaultClassName() { return defaultClassName; }

    public void setErrorListener(NovaErrorListener listener) {
        this.errorListener = listener;
    }

    /** Lexes and parses without executing. */
    public List<Stmt> parse(String source) {
        try {
            return frontEnd(source);
        } catch (RuntimeException e) {
            report("parse", e);
            return Collections.emptyList();
        }
    }

    /** Runs a program in a fresh environment and returns the final variable bindings. */
    public Map<String, Value> run(String source) {
        return run(source, Collections.emptyMap());
    }

    /** Runs a program with pre-bound variables. Returns the final environment snapshot. */
    public Map<String, Value> run(String source, Map<String, Value> initialEnv) {
        Environment env = new Environment(initialEnv);
        try {
            List<Stmt> program = frontEnd(source);
            new Interpreter(env, output, getAcknowledgment()).execute(program);
            return env.snapshot();
        } catch (RuntimeException e) {
            report("run", e);
            return env.snapshot();
        }
    }

    public GenerationResult compile(String source) {
        return compile(source, defaultClassName);
    }

    /** Generates C# for {@code source}; returns null when a listener suppressed a failure. */
    public GenerationResult compile(String source, String className) {
        try {
            return generator.generate(frontEnd(source), className);
        } catch (RuntimeException e) {
            report("compile", e);
            return null;
        }
    }

    private List<Stmt> frontEnd(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        List<Token> tokens = new Lexer(source).tokenize();
        Debug.get().d(TAG, "tokens=" + tokens.size());
        return new Parser(tokens, source).parse();
    }

    private void report(String phase, RuntimeException e) {
        Debug.get().e(TAG, phase + " failed: " + e.getMessage());
        if (errorListener == null) throw e;
        errorListener.onError(phase, e);
    }
}
