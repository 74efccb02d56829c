package com.agilab.image_archiving.model;

public enum FailureKind {
    EXTRACTION_FAILED,
    FILESYSTEM_ERROR,
    CONVERSION_FAILED,
    TOOL_MISSING,
    TIMEOUT,
    CANCELLED,
    NOT_PROCESSED,
    INTERNAL_ERROR
}
