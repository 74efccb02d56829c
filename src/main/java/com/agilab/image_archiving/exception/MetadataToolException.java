package com.agilab.image_archiving.exception;

/**
 * The metadata tool could not be invoked at all. Fatal for the whole run.
 */
public class MetadataToolException extends RuntimeException {

    public MetadataToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
