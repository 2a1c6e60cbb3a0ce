package com.oncall.core.error;

/**
 * Thrown when a query does not resolve to any investigable device.
 */
public class InvalidTargetException extends InvestigationException {
    public InvalidTargetException(String message) {
        super(message);
    }

    public InvalidTargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
