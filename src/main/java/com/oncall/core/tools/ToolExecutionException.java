package com.oncall.core.tools;

import com.oncall.core.model.ToolError;
import com.oncall.core.model.ToolErrorType;

/**
 * A failed call against a device. Recorded on the invocation; never aborts a session.
 */
public class ToolExecutionException extends Exception {

    private final ToolErrorType type;

    public ToolExecutionException(ToolErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public ToolExecutionException(ToolErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ToolErrorType getType() {
        return type;
    }

    public ToolError toToolError() {
        return new ToolError(type, getMessage());
    }
}
