package com.nova.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.nova.debug.Debug;
import com.nova.debug.DebugLevel;
import com.nova.debug.StdErrDebugSink;
import com.nova.script.codegen.GenerationResult;
import com.nova.script.host.BuildReport;
import com.nova.script.host.BuildRequest;
import com.nova.script.host.CscToolchainInvoker;
import com.nova.script.host.IcoImageConverter;
import com.nova.script.host.NovaBuilder;
import com.nova.script.parser.NovaException;

/**
 * Command line front end.
 *
 * <pre>
 *   NovaCli app.nova                          run (default)
 *   NovaCli --mode=compile --class=App app.nova [--out=App.cs]
 *   NovaCli --mode=build --csc=/path/csc.exe --refs=a.dll;b.dll [--library] app.nova
 *   --debug=DEBUG                             log level on stderr (default WARN)
 * </pre>
 */
public final class NovaCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Map<String, String> flags = parseArgs(args);
        List<String> files = positional(args);
        if (files.size() != 1) {
            System.err.println("Usage: NovaCli [--mode=run|compile|build] [--class=Name] [--out=file.cs] <script.nova>");
            return EXIT_USAGE;
        }

        DebugLevel level;
        try {
            level = DebugLevel.valueOf(flags.getOrDefault("debug", "WARN").toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Unknown debug level: " + flags.get("debug"));
            return EXIT_USAGE;
        }
        Debug.get().install(new StdErrDebugSink(), level);

        Path scriptPath = Paths.get(files.get(0));
        NovaScript engine = new NovaScript();
        if (flags.containsKey("class")) engine.setDefaultClassName(flags.get("class"));

        String mode = flags.getOrDefault("mode", "run");
        try {
            switch (mode) {
                case "run":
                    engine.run(read(scriptPath));
                    return EXIT_OK;
                case "compile":
                    return compile(engine, scriptPath, flags.get("out"));
                case "build":
                    return build(engine, scriptPath, flags);
                default:
                    System.err.println("Unknown mode: " + mode);
                    return EXIT_USAGE;
            }
        } catch (NovaException e) {
            System.err.println("Nova Error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private static int compile(NovaScript engine, Path scriptPath, String out) throws IOException {
        GenerationResult result = engine.compile(read(scriptPath));
        Path target = (out != null)
                ? Paths.get(out)
                : scriptPath.toAbsolutePath().resolveSibling(result.className() + ".cs");
        Files.writeString(target, result.source(), StandardCharsets.UTF_8);
        System.err.println("Wrote " + target);
        System.out.println(result.metadata().toJson());
        return EXIT_OK;
    }

    private static int build(NovaScript engine, Path scriptPath, Map<String, String> flags) throws IOException {
        Path csc = CscToolchainInvoker.locate(flags.get("csc"));
        if (csc == null) {
            System.err.println("C# compiler (csc) not found. Install the .NET SDK or pass --csc=<path>.");
            return EXIT_USAGE;
        }
        BuildRequest request = new BuildRequest(scriptPath, flags.get("class"), flags.containsKey("library"),
                BuildRequest.parseReferences(flags.get("refs")));
        NovaBuilder builder = new NovaBuilder(engine, new IcoImageConverter(), new CscToolchainInvoker(csc));
        BuildReport report = builder.build(request);
        System.out.println(report.toJson());
        return report.success() ? EXIT_OK : EXIT_SCRIPT_ERROR;
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Minimal arg parser:
     *   --mode=compile --class=App --out=App.cs
     *   --library (flag without value)
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    static List<String> positional(String[] args) {
        List<String> out = new ArrayList<>();
        for (String a : args) {
            if (!a.startsWith("--")) out.add(a);
        }
        return out;
    }

    private NovaCli() {}
}
