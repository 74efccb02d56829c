package com.agilab.image_archiving.model;

public enum ConversionState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
