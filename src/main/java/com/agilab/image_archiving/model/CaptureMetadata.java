package com.agilab.image_archiving.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Capture metadata of a readable file. Make and model are never null: absent fields
 * hold {@link #UNKNOWN_MAKE} and {@link #UNKNOWN_MODEL}.
 */
public record CaptureMetadata(LocalDateTime captureTime, String make, String model) implements MetadataResult {

    public static final String UNKNOWN_MAKE = "unknown_make";
    public static final String UNKNOWN_MODEL = "unknown_model";

    public CaptureMetadata {
        make = make == null || make.isBlank() ? UNKNOWN_MAKE : make;
        model = model == null || model.isBlank() ? UNKNOWN_MODEL : model;
    }

    public Optional<LocalDateTime> findCaptureTime() {
        return Optional.ofNullable(captureTime);
    }
}
