package com.oncall.core.model;

public enum ObjectiveStatus {
    UNKNOWN,
    ACHIEVED,
    NOT_ACHIEVED,
    CANCELLED
}
