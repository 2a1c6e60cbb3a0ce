package com.oncall.core.model;

/**
 * Lifecycle status of one device investigation.
 */
public enum InvestigationStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
