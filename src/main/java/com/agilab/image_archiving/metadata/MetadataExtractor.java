package com.agilab.image_archiving.metadata;

import com.agilab.image_archiving.model.MetadataResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads capture metadata for a batch of files.
 */
public interface MetadataExtractor {

    /**
     * Returns a result for every requested path: {@link com.agilab.image_archiving.model.CaptureMetadata}
     * (with fallbacks for absent fields) or {@link com.agilab.image_archiving.model.ExtractionFailure}
     * when the file could not be read at all.
     *
     * @throws com.agilab.image_archiving.exception.MetadataToolException if the tool cannot be invoked
     * @throws InterruptedException if the run is cancelled while the tool is running
     */
    Map<Path, MetadataResult> extract(List<Path> paths) throws InterruptedException;
}
