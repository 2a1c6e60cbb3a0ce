package com.oncall.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The plan chosen for one device.
 *
 * @param deviceName device the choice applies to
 * @param intent key of the chosen plan
 * @param objective device-specific objective text; blank means the plan's own objective
 */
public record PlanChoice(
    @JsonProperty("device_name") String deviceName,
    @JsonProperty("intent") String intent,
    @JsonProperty("objective") String objective
) {
}
