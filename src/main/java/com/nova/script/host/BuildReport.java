package com.nova.script.host;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.script.codegen.GenerationMetadata;

/** Outcome of one {@link NovaBuilder#build} call, printable as JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "className", "outputKind", "outputFile", "references", "iconFile",
        "warnings", "metadata", "toolchain"})
public final class BuildReport {

    private static final ObjectMapper om = new ObjectMapper();

    private final String className;
    private final OutputKind outputKind;
    private final String outputFile;
    private final List<String> references;
    private final String iconFile;
    private final List<String> warnings;
    private final GenerationMetadata metadata;
    private final ToolchainResult toolchain;

    BuildReport(String className, OutputKind outputKind, String outputFile, List<String> references,
                String iconFile, List<String> warnings, GenerationMetadata metadata, ToolchainResult toolchain) {
        this.className = className;
        this.outputKind = outputKind;
        this.outputFile = outputFile;
        this.references = Collections.unmodifiableList(new ArrayList<>(references));
        this.iconFile = iconFile;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.metadata = metadata;
        this.toolchain = toolchain;
    }

    @JsonProperty("success")
    public boolean success() { return toolchain != null && toolchain.success(); }

    @JsonProperty("className")
    public String className() { return className; }

    @JsonProperty("outputKind")
    public OutputKind outputKind() { return outputKind; }

    @JsonProperty("outputFile")
    public String outputFile() { return outputFile; }

    @JsonProperty("references")
    public List<String> references() { return references; }

    /** Icon file placed next to the output, or null when none was shipped. */
    @JsonProperty("iconFile")
    public String iconFile() { return iconFile; }

    @JsonProperty("warnings")
    public List<String> warnings() { return warnings; }

    @JsonProperty("metadata")
    public GenerationMetadata metadata() { return metadata; }

    @JsonProperty("toolchain")
    public ToolchainResult toolchain() { return toolchain; }

    public String toJson() {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("build report could not be serialized", e);
        }
    }
}
