package com.nova.script.host;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One {@code .nova} file to turn into an executable or library. Output, icon assets and
 * the intermediate C# file all land in the source file's directory.
 */
public final class BuildRequest {
    private final Path sourceFile;
    private final String className;
    private final boolean library;
    private final List<String> extraReferences;

    public BuildRequest(Path sourceFile, String className, boolean library, List<String> extraReferences) {
        if (sourceFile == null) throw new IllegalArgumentException("sourceFile must not be null");
        this.sourceFile = sourceFile;
        this.className = className;
        this.library = library;
        this.extraReferences = (extraReferences == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(extraReferences));
    }

    public static BuildRequest of(Path sourceFile) {
        return new BuildRequest(sourceFile, null, false, null);
    }

    /** Splits a user-entered reference list; both {@code ;} and {@code ,} separate entries. */
    public static List<String> parseReferences(String list) {
        List<String> out = new ArrayList<>();
        if (list == null) return out;
        for (String part : list.replace(',', ';').split(";")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    public Path sourceFile() { return sourceFile; }

    /** Null means the engine's default class name. */
    public String className() { return className; }

    public boolean library() { return library; }

    public List<String> extraReferences() { return extraReferences; }

    public Path sourceDirectory() {
        Path parent = sourceFile.toAbsolutePath().getParent();
        return (parent == null) ? sourceFile.toAbsolutePath() : parent;
    }

    /** {@code hello.nova} becomes {@code hello.exe} or {@code hello.dll}. */
    public Path outputFile(OutputKind kind) {
        String name = sourceFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = (dot > 0) ? name.substring(0, dot) : name;
        return sourceDirectory().resolve(stem + kind.extension());
    }
}
