package com.oncall.core.llm;

import com.oncall.core.error.InvestigationException;

/**
 * Thrown when model output cannot be parsed into the expected type.
 */
public class LlmParseException extends InvestigationException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
