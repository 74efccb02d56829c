package com.agilab.image_archiving.model;

import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;

/**
 * Planned destination of a file: {@code <root>/<date>_<project>/<make>_<model>_<ext>/<name>}.
 */
public record TargetLocation(Path directory, String fileName, int sequence) {

    public Path path() {
        return directory.resolve(fileName);
    }

    /**
     * Sibling path with the same base name and another extension, e.g. the DNG next to a RAW file.
     */
    public Path withExtension(String extension) {
        return directory.resolve(FilenameUtils.getBaseName(fileName) + "." + extension);
    }
}
