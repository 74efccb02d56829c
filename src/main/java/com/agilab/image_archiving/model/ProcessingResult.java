package com.agilab.image_archiving.model;

import java.nio.file.Path;

/**
 * Terminal outcome of one input file. {@code target} is the placed (or planned) path and
 * {@code convertedTarget} the DNG path; either is null when the file never got that far.
 */
public record ProcessingResult(SourceFile source,
                               ProcessingOutcome outcome,
                               Path target,
                               Path convertedTarget,
                               FailureKind failureKind,
                               String reason) {

    public static ProcessingResult renamed(SourceFile source, Path target) {
        return new ProcessingResult(source, ProcessingOutcome.RENAMED, target, null, null, null);
    }

    public static ProcessingResult renamedAndConverted(SourceFile source, Path target, Path converted) {
        return new ProcessingResult(source, ProcessingOutcome.RENAMED_AND_CONVERTED, target, converted, null, null);
    }

    public static ProcessingResult planned(SourceFile source, Path target) {
        return new ProcessingResult(source, ProcessingOutcome.PLANNED, target, null, null, null);
    }

    public static ProcessingResult failed(SourceFile source, FailureKind kind, String reason) {
        return failed(source, null, kind, reason);
    }

    public static ProcessingResult failed(SourceFile source, Path target, FailureKind kind, String reason) {
        return new ProcessingResult(source, ProcessingOutcome.FAILED, target, null, kind, reason);
    }

    public boolean isFailure() {
        return outcome == ProcessingOutcome.FAILED;
    }
}
