package com.agilab.image_archiving.exception;

import java.io.IOException;
import java.time.Duration;

/**
 * An external process exceeded its wall-clock limit and was killed.
 */
public class ProcessTimeoutException extends IOException {

    private final Duration timeout;

    public ProcessTimeoutException(String processName, Duration timeout) {
        super(processName + " process timed out after " + timeout.toSeconds() + " seconds and was killed.");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
