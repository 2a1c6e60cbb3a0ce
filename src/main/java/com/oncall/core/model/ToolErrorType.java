package com.oncall.core.model;

/**
 * Failure categories a tool executor may report.
 */
public enum ToolErrorType {
    COMMUNICATION,
    AUTHENTICATION,
    PROTOCOL,
    FUNCTION_VALIDATION
}
