package com.nova.script.host;

import java.nio.file.Path;

/** Converts a raster image into a Windows icon. */
public interface ImageConverter {
    /** @return false when the conversion could not be done; the caller falls back to a plain copy. */
    boolean convert(Path source, Path target);
}
