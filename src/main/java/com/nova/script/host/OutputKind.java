package com.nova.script.host;

/** What the C# toolchain produces. */
public enum OutputKind {
    EXE("exe", ".exe"),
    WINEXE("winexe", ".exe"),
    LIBRARY("library", ".dll");

    private final String target;
    private final String extension;

    OutputKind(String target, String extension) {
        this.target = target;
        this.extension = extension;
    }

    /** csc {@code /target:} value. */
    public String target() { return target; }

    public String extension() { return extension; }
}
