package com.oncall.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A device named by the user's query.
 *
 * @param deviceName device identifier as known to the tool executor
 * @param deviceProfile device class or platform, "unknown" when not stated
 * @param role the device's role in the network, may be empty
 */
public record TargetDevice(
    @JsonProperty("device_name") String deviceName,
    @JsonProperty("device_profile") String deviceProfile,
    @JsonProperty("role") String role
) implements Serializable {

    public static final String UNKNOWN_PROFILE = "unknown";

    public TargetDevice {
        deviceProfile = deviceProfile == null || deviceProfile.isBlank() ? UNKNOWN_PROFILE : deviceProfile.trim();
        role = role == null ? "" : role.trim();
    }
}
