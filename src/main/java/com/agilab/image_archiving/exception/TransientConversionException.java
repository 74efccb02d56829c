package com.agilab.image_archiving.exception;

import com.agilab.image_archiving.process.ProcessExecutor.ProcessResult;

/**
 * A converter invocation failed with an error classified as transient, e.g. resource temporarily unavailable.
 */
public class TransientConversionException extends RuntimeException {

    private final transient ProcessResult result;

    public TransientConversionException(String message, ProcessResult result) {
        super(message);
        this.result = result;
    }

    public ProcessResult getResult() {
        return result;
    }
}
