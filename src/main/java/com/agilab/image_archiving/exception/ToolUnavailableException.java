package com.agilab.image_archiving.exception;

import java.io.IOException;

/**
 * An external tool binary could not be found or launched.
 */
public class ToolUnavailableException extends IOException {

    private final String toolName;

    public ToolUnavailableException(String toolName, String binary, Throwable cause) {
        super(String.format("%s is not available (tried '%s'): %s", toolName, binary,
                cause == null ? "not found" : cause.getMessage()), cause);
        this.toolName = toolName;
    }

    public ToolUnavailableException(String toolName, String binary) {
        this(toolName, binary, null);
    }

    public String getToolName() {
        return toolName;
    }
}
