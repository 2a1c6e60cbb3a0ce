package com.oncall.core.model;

/**
 * Semantic judgement of one device's results against its objective.
 */
public enum DeviceVerdict {
    /** The gathered data satisfies the objective. */
    MET,
    /** The objective cannot be met because of device or tool limitations; retrying will not help. */
    LIMITED,
    /** Not met, but another pass with feedback may help. */
    UNMET
}
