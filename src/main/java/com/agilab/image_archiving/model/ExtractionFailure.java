package com.agilab.image_archiving.model;

/**
 * The metadata tool could not read the file at all.
 */
public record ExtractionFailure(String reason) implements MetadataResult {
}
