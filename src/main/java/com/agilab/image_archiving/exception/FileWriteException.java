package com.agilab.image_archiving.exception;

/**
 * Exception thrown when a file cannot be written into the archive (permissions, disk full, ...).
 */
public final class FileWriteException extends RuntimeException implements FileProcessingException {
    private final String filePath;

    public FileWriteException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public FileWriteException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    @Override
    public String getFilePath() {
        return filePath;
    }
}
