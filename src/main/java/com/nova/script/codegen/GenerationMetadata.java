package com.nova.script.codegen;

import java.io.UncheckedIOException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** What the generated program needs from the toolchain and the host. */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"needsGuiCapability", "needsGraphicsCapability", "iconSourcePath",
        "iconTargetBasename", "iconNeedsRasterConversion", "needsDynamicBinding"})
public final class GenerationMetadata {

    private static final ObjectMapper om = new ObjectMapper();

    private final boolean needsGuiCapability;
    private final boolean needsGraphicsCapability;
    private final String iconSourcePath;
    private final String iconTargetBasename;
    private final boolean iconNeedsRasterConversion;
    private final boolean needsDynamicBinding;

    @JsonCreator
    public GenerationMetadata(
            @JsonProperty("needsGuiCapability") boolean needsGuiCapability,
            @JsonProperty("needsGraphicsCapability") boolean needsGraphicsCapability,
            @JsonProperty("iconSourcePath") String iconSourcePath,
            @JsonProperty("iconTargetBasename") String iconTargetBasename,
            @JsonProperty("iconNeedsRasterConversion") boolean iconNeedsRasterConversion,
            @JsonProperty("needsDynamicBinding") boolean needsDynamicBinding) {
        this.needsGuiCapability = needsGuiCapability;
        this.needsGraphicsCapability = needsGraphicsCapability;
        this.iconSourcePath = iconSourcePath;
        this.iconTargetBasename = iconTargetBasename;
        this.iconNeedsRasterConversion = iconNeedsRasterConversion;
        this.needsDynamicBinding = needsDynamicBinding;
    }

    @JsonProperty("needsGuiCapability")
    public boolean needsGuiCapability() { return needsGuiCapability; }

    @JsonProperty("needsGraphicsCapability")
    public boolean needsGraphicsCapability() { return needsGraphicsCapability; }

    /** Path exactly as written in {@code set_icon}, or null when the program sets no icon. */
    @JsonProperty("iconSourcePath")
    public String iconSourcePath() { return iconSourcePath; }

    /** File name the generated program loads its icon from at run time. */
    @JsonProperty("iconTargetBasename")
    public String iconTargetBasename() { return iconTargetBasename; }

    @JsonProperty("iconNeedsRasterConversion")
    public boolean iconNeedsRasterConversion() { return iconNeedsRasterConversion; }

    /** True when the program has variables, which are emitted as {@code dynamic} locals. */
    @JsonProperty("needsDynamicBinding")
    public boolean needsDynamicBinding() { return needsDynamicBinding; }

    public boolean hasIcon() {
        return iconSourcePath != null;
    }

    public String toJson() {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("metadata could not be serialized", e);
        }
    }

    public static GenerationMetadata fromJson(String json) {
        try {
            return om.readValue(json, GenerationMetadata.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("metadata could not be parsed", e);
        }
    }

    @Override
    public String toString() {
        return "GenerationMetadata{gui=" + needsGuiCapability + ", graphics=" + needsGraphicsCapability
                + ", icon=" + iconSourcePath + " -> " + iconTargetBasename
                + (iconNeedsRasterConversion ? " (convert)" : "")
                + ", dynamic=" + needsDynamicBinding + "}";
    }
}
