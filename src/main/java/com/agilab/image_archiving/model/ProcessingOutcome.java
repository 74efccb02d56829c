package com.agilab.image_archiving.model;

public enum ProcessingOutcome {
    RENAMED,
    RENAMED_AND_CONVERTED,
    PLANNED,
    FAILED
}
