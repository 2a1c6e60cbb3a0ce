package com.oncall.core.error;

/**
 * Thrown when a plan is unknown, unreadable or malformed.
 */
public class PlanDocumentException extends InvestigationException {
    public PlanDocumentException(String message) {
        super(message);
    }

    public PlanDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
