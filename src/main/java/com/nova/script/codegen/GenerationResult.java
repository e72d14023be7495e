package com.nova.script.codegen;

public class GenerationResult {
    private final String className;
    private final String source;
    private final GenerationMetadata metadata;

    public GenerationResult(String className, String source, GenerationMetadata metadata) {
        this.className = className;
        this.source = source;
        this.metadata = metadata;
    }

    public String className() { return className; }
    public String source() { return source; }
    public GenerationMetadata metadata() { return metadata; }
}
