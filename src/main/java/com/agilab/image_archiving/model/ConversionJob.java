package com.agilab.image_archiving.model;

import java.nio.file.Path;

/**
 * One RAW to DNG conversion. Transitions return new instances:
 * {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}.
 */
public record ConversionJob(Path source,
                            Path target,
                            ConversionState state,
                            Integer exitCode,
                            FailureKind failureKind,
                            String reason) {

    public static ConversionJob pending(Path source, Path target) {
        return new ConversionJob(source, target, ConversionState.PENDING, null, null, null);
    }

    public ConversionJob running() {
        requireState(ConversionState.PENDING);
        return new ConversionJob(source, target, ConversionState.RUNNING, null, null, null);
    }

    public ConversionJob succeeded(int exitCode) {
        requireState(ConversionState.RUNNING);
        return new ConversionJob(source, target, ConversionState.SUCCEEDED, exitCode, null, null);
    }

    public ConversionJob failed(FailureKind kind, Integer exitCode, String reason) {
        if (isTerminal()) {
            throw new IllegalStateException("Conversion job for " + source + " is already " + state);
        }
        return new ConversionJob(source, target, ConversionState.FAILED, exitCode, kind, reason);
    }

    public ConversionJob failed(FailureKind kind, String reason) {
        return failed(kind, null, reason);
    }

    public boolean isTerminal() {
        return state == ConversionState.SUCCEEDED || state == ConversionState.FAILED;
    }

    private void requireState(ConversionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    String.format("Conversion job for %s is %s, expected %s", source, state, expected));
        }
    }
}
