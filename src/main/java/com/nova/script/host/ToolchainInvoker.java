package com.nova.script.host;

import java.nio.file.Path;
import java.util.List;

/** The external C# compiler. */
public interface ToolchainInvoker {
    ToolchainResult build(String source, List<String> references, OutputKind kind, Path outputFile);
}
