package com.oncall.core.model;

/**
 * Phase of an investigation session.
 */
public enum SessionStatus {
    VALIDATING,
    PLANNING,
    EXECUTING,
    ASSESSING,
    REPORTING,
    DONE,
    CANCELLED
}
