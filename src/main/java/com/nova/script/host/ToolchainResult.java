package com.nova.script.host;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"success", "exitCode", "diagnostics"})
public final class ToolchainResult {
    private final boolean success;
    private final int exitCode;
    private final String diagnostics;

    @JsonCreator
    public ToolchainResult(@JsonProperty("success") boolean success,
                           @JsonProperty("exitCode") int exitCode,
                           @JsonProperty("diagnostics") String diagnostics) {
        this.success = success;
        this.exitCode = exitCode;
        this.diagnostics = (diagnostics == null) ? "" : diagnostics;
    }

    public static ToolchainResult failed(String diagnostics) {
        return new ToolchainResult(false, -1, diagnostics);
    }

    @JsonProperty("success")
    public boolean success() { return success; }

    @JsonProperty("exitCode")
    public int exitCode() { return exitCode; }

    /** Compiler stdout followed by stderr. */
    @JsonProperty("diagnostics")
    public String diagnostics() { return diagnostics; }

    @Override
    public String toString() {
        return "ToolchainResult{success=" + success + ", exitCode=" + exitCode + "}";
    }
}
