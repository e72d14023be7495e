package com.nova.script.host;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.nova.debug.Debug;

/**
 * Runs {@code csc} on a temporary {@code temp_build.cs} written next to the output file.
 * The temporary file is removed afterwards whatever the outcome.
 */
public class CscToolchainInvoker implements ToolchainInvoker {
    private static final String TAG = "CscToolchainInvoker";

    static final String TEMP_SOURCE = "temp_build.cs";

    private static final List<String> WELL_KNOWN_LOCATIONS = Arrays.asList(
            "C:\\Windows\\Microsoft.NET\\Framework64\\v4.0.30319\\csc.exe",
            "C:\\Windows\\Microsoft.NET\\Framework\\v4.0.30319\\csc.exe");

    private final Path csc;

    public CscToolchainInvoker(Path csc) {
        this.csc = csc;
    }

    /**
     * Finds the compiler: an explicit path first, then {@code csc} on the PATH, then the
     * .NET Framework install locations.
     *
     * @return the compiler, or null when none was found
     */
    public static Path locate(String customPath) {
        if (customPath != null) {
            String p = customPath.trim().replace("\"", "");
            if (!p.isEmpty() && Files.exists(Paths.get(p))) return Paths.get(p);
        }
        String pathVar = System.getenv("PATH");
        if (pathVar != null) {
            for (String dir : pathVar.split(java.io.File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                for (String exe : new String[] {"csc", "csc.exe"}) {
                    Path candidate = Paths.get(dir, exe);
                    if (Files.isExecutable(candidate)) return candidate;
                }
            }
        }
        for (String known : WELL_KNOWN_LOCATIONS) {
            Path candidate = Paths.get(known);
            if (Files.exists(candidate)) return candidate;
        }
        return null;
    }

    /** Command line for one build, in the order csc expects it. */
    public List<String> command(Path sourceFile, List<String> references, OutputKind kind, Path outputFile) {
        List<String> cmd = new ArrayList<>();
        cmd.add(csc.toString());
        cmd.add("/target:" + kind.target());
        if (!references.isEmpty()) cmd.add("/reference:" + String.join(";", references));
        cmd.add("/out:" + outputFile);
        cmd.add(sourceFile.toString());
        return cmd;
    }

    @Override
    public ToolchainResult build(String source, List<String> references, OutputKind kind, Path outputFile) {
        Path dir = outputFile.toAbsolutePath().getParent();
        Path temp = dir.resolve(TEMP_SOURCE);
        try {
            Files.writeString(temp, source, StandardCharsets.UTF_8);
            List<String> cmd = command(temp, references, kind, outputFile);
            Debug.get().d(TAG, "running " + String.join(" ", cmd));

            ProcessBuilder processBuilder = new ProcessBuilder(cmd);
            processBuilder.directory(dir.toFile());
            processBuilder.redirectErrorStream(true);
            Process process = processBuilder.start();

            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                }
            }
            int exit = process.waitFor();
            return new ToolchainResult(exit == 0, exit, output.toString());
        } catch (IOException e) {
            return ToolchainResult.failed("Failed to run csc: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolchainResult.failed("Interrupted while waiting for csc");
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                Debug.get().w(TAG, "could not remove " + temp + ": " + e.getMessage());
            }
        }
    }
}
