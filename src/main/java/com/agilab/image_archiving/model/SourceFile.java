package com.agilab.image_archiving.model;

import java.nio.file.Path;

/**
 * A discovered input file. The extension is lower-cased and carries no dot.
 */
public record SourceFile(Path path, MediaKind kind, String extension) {

    public boolean isConvertible() {
        return kind == MediaKind.RAW && MediaKind.isConvertible(extension);
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
