package com.agilab.image_archiving.model;

/**
 * Outcome of reading capture metadata for one file.
 */
public sealed interface MetadataResult permits CaptureMetadata, ExtractionFailure {
}
