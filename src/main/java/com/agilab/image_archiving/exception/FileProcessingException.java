package com.agilab.image_archiving.exception;

/**
 * Per-file failures while placing a file into the archive.
 * They never escape the file's own task: the pipeline turns them into a failed result.
 */
public sealed interface FileProcessingException
        permits FileReadException, FileWriteException {

    String getFilePath();
    String getMessage();
    Throwable getCause();
}
