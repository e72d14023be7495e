package com.nova.script.codegen;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decides how a {@code set_icon} path is shipped: raster images are referenced under
 * the same stem with an {@code .ico} extension and flagged for conversion, anything
 * else is loaded as-is.
 */
public final class IconResolution {
    public static final String ICON_EXTENSION = ".ico";

    private static final Set<String> RASTER_EXTENSIONS =
            new HashSet<>(Arrays.asList(".png", ".jpg", ".jpeg", ".bmp", ".gif"));

    private final String sourcePath;
    private final String sourceBasename;
    private final String targetBasename;
    private final boolean needsRasterConversion;

    private IconResolution(String sourcePath, String sourceBasename, String targetBasename, boolean needsRasterConversion) {
        this.sourcePath = sourcePath;
        this.sourceBasename = sourceBasename;
        this.targetBasename = targetBasename;
        this.needsRasterConversion = needsRasterConversion;
    }

    public static IconResolution resolve(String path) {
        String basename = basename(path);
        int dot = basename.lastIndexOf('.');
        String extension = (dot > 0) ? basename.substring(dot).toLowerCase(Locale.ROOT) : "";
        if (RASTER_EXTENSIONS.contains(extension)) {
            return new IconResolution(path, basename, basename.substring(0, dot) + ICON_EXTENSION, true);
        }
        return new IconResolution(path, basename, basename, false);
    }

    static String basename(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return (slash >= 0) ? path.substring(slash + 1) : path;
    }

    public String sourcePath() { return sourcePath; }
    public String sourceBasename() { return sourceBasename; }
    public String targetBasename() { return targetBasename; }
    public boolean needsRasterConversion() { return needsRasterConversion; }
}
