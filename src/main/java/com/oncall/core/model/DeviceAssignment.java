package com.oncall.core.model;

import java.io.Serializable;

/**
 * Work handed to a device investigator for one execution pass.
 *
 * @param device current state of the device, including retry feedback and prior outcomes
 * @param attempt 1-based execution pass number
 * @param learnedContext historical context from earlier sessions, may be empty
 */
public record DeviceAssignment(
    DeviceInvestigationState device,
    int attempt,
    String learnedContext
) implements Serializable {

    public String deviceName() {
        return device.deviceName();
    }
}
