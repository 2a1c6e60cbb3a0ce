package com.oncall.core.error;

/**
 * Base type for errors that abort an investigation session.
 */
public class InvestigationException extends RuntimeException {
    public InvestigationException(String message) {
        super(message);
    }

    public InvestigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
