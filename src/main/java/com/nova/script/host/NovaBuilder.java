package com.nova.script.host;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import com.nova.debug.Debug;
import com.nova.script.NovaScript;
import com.nova.script.codegen.GenerationMetadata;
import com.nova.script.codegen.GenerationResult;

/**
 * Turns a {@code .nova} file into a program: generates C#, ships the window icon next
 * to the output and hands the source to the C# toolchain.
 *
 * Icon problems never fail a build; they end up in {@link BuildReport#warnings()}.
 */
public class NovaBuilder {
    private static final String TAG = "NovaBuilder";

    public static final String FORMS_REFERENCE = "System.Windows.Forms.dll";
    public static final String DRAWING_REFERENCE = "System.Drawing.dll";
    public static final String CORE_REFERENCE = "System.Core.dll";
    public static final String CSHARP_BINDER_REFERENCE = "Microsoft.CSharp.dll";

    private final NovaScript engine;
    private final ImageConverter imageConverter;
    private final ToolchainInvoker toolchain;

    public NovaBuilder(NovaScript engine, ImageConverter imageConverter, ToolchainInvoker toolchain) {
        this.engine = engine;
        this.imageConverter = imageConverter;
        this.toolchain = toolchain;
    }

    /**
     * @throws IOException when the source file cannot be read
     * @throws com.nova.script.parser.NovaException when the program does not compile
     */
    public BuildReport build(BuildRequest request) throws IOException {
        String source = Files.readString(request.sourceFile(), StandardCharsets.UTF_8);
        String className = (request.className() == null) ? engine.getDefaultClassName() : request.className();

        GenerationResult generated = engine.compile(source, className);
        if (generated == null) {
            // the engine's error listener already saw the failure
            return new BuildReport(className, null, null, new ArrayList<>(), null,
                    List.of("generation failed"), null, ToolchainResult.failed("generation failed"));
        }
        GenerationMetadata meta = generated.metadata();

        List<String> warnings = new ArrayList<>();
        String iconFile = meta.hasIcon() ? shipIcon(request.sourceDirectory(), meta, warnings) : null;

        OutputKind kind = outputKind(request, meta);
        List<String> references = references(meta, request.extraReferences());
        Path outputFile = request.outputFile(kind);

        Debug.get().i(TAG, "Compiling " + request.sourceFile().getFileName() + " -> " + outputFile.getFileName());
        ToolchainResult result = toolchain.build(generated.source(), references, kind, outputFile);
        if (result.success()) {
            Debug.get().i(TAG, "SUCCESS: Created " + outputFile.getFileName());
        } else {
            Debug.get().w(TAG, "FAILED: " + result.diagnostics());
        }

        return new BuildReport(generated.className(), kind, outputFile.toString(), references,
                iconFile, warnings, meta, result);
    }

    static OutputKind outputKind(BuildRequest request, GenerationMetadata meta) {
        if (request.library()) return OutputKind.LIBRARY;
        return meta.needsGuiCapability() ? OutputKind.WINEXE : OutputKind.EXE;
    }

    static List<String> references(GenerationMetadata meta, List<String> extra) {
        List<String> refs = new ArrayList<>();
        if (meta.needsGuiCapability()) refs.add(FORMS_REFERENCE);
        if (meta.needsGraphicsCapability()) refs.add(DRAWING_REFERENCE);
        if (meta.needsDynamicBinding()) {
            refs.add(CORE_REFERENCE);
            refs.add(CSHARP_BINDER_REFERENCE);
        }
        for (String r : extra) {
            if (!refs.contains(r)) refs.add(r);
        }
        return refs;
    }

    /**
     * Places the icon in {@code outputDir} under the name the generated program loads.
     * Raster images are converted; when conversion fails the source image is copied
     * under its own name so the program's placeholder can still show it.
     *
     * @return the shipped file, or null when nothing could be shipped
     */
    private String shipIcon(Path outputDir, GenerationMetadata meta, List<String> warnings) {
        Path declared = Paths.get(meta.iconSourcePath());
        Path candidate = declared.isAbsolute() ? declared : outputDir.resolve(declared);
        if (!Files.exists(candidate)) {
            warn(warnings, "icon path not found: " + candidate);
            return null;
        }

        try {
            if (meta.iconNeedsRasterConversion()) {
                Path ico = outputDir.resolve(meta.iconTargetBasename());
                if (imageConverter != null && imageConverter.convert(candidate, ico)) {
                    Debug.get().i(TAG, "Converted icon " + candidate + " -> " + ico);
                    return ico.toString();
                }
                warn(warnings, "icon conversion failed, copying " + candidate.getFileName() + " as is");
                return copy(candidate, outputDir.resolve(candidate.getFileName().toString()));
            }
            return copy(candidate, outputDir.resolve(meta.iconTargetBasename()));
        } catch (IOException e) {
            warn(warnings, "failed to copy icon: " + e.getMessage());
            return null;
        }
    }

    private static String copy(Path from, Path to) throws IOException {
        // an icon already sitting in the output directory stays where it is
        if (!from.toAbsolutePath().normalize().equals(to.toAbsolutePath().normalize())) {
            Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
        Debug.get().i(TAG, "Copied icon " + from + " -> " + to);
        return to.toString();
    }

    private static void warn(List<String> warnings, String message) {
        warnings.add(message);
        Debug.get().w(TAG, message);
    }
}
