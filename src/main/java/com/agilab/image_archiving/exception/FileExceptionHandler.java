package com.agilab.image_archiving.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies and logs per-file exceptions.
 */
@Slf4j
@Component
public class FileExceptionHandler {

    public String getErrorType(FileProcessingException exception) {
        if (exception instanceof FileReadException) {
            return "READ_ERROR";
        }
        return "WRITE_ERROR";
    }

    public String getErrorSeverity(FileProcessingException exception) {
        if (exception instanceof FileReadException) {
            return "MEDIUM";
        }
        return "HIGH";
    }

    public String describe(FileProcessingException exception) {
        var cause = exception.getCause();
        return cause == null || cause.getMessage() == null
                ? exception.getMessage()
                : exception.getMessage() + ": " + cause.getMessage();
    }

    public void logException(FileProcessingException exception) {
        var severity = getErrorSeverity(exception);
        var filePath = exception.getFilePath();

        if (exception instanceof FileReadException) {
            log.warn("[{}] Failed to read file: {} - {}", severity, filePath, describe(exception));
        } else {
            log.error("[{}] Failed to write file: {} - {}", severity, filePath, describe(exception));
        }
    }
}
