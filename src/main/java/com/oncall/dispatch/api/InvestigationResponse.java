package com.oncall.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oncall.core.engine.InvestigationResult;
import com.oncall.core.model.DeviceInvestigationState;

import java.util.List;

/**
 * JSON response for investigation endpoints.
 */
public record InvestigationResponse(
    @JsonProperty("session_id") String sessionId,
    String query,
    String status,
    @JsonProperty("objective_status") String objectiveStatus,
    @JsonProperty("forced_acceptance") boolean forcedAcceptance,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("execution_passes") int executionPasses,
    List<DeviceResponse> devices,
    String report,
    List<String> errors
) {

    public record DeviceResponse(
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("device_profile") String deviceProfile,
        String intent,
        String status,
        int attempts,
        @JsonProperty("steps_executed") int stepsExecuted,
        @JsonProperty("limitations_notes") String limitationsNotes,
        @JsonProperty("retry_feedback") String retryFeedback,
        @JsonProperty("error_details") String errorDetails
    ) {

        static DeviceResponse from(DeviceInvestigationState device) {
            return new DeviceResponse(device.deviceName(), device.deviceProfile(), device.intent(),
                    device.status().name(), device.attempts(), device.stepOutcomes().size(),
                    device.limitationsNotes(), device.retryFeedback(), device.errorDetails());
        }
    }

    static InvestigationResponse from(InvestigationResult result) {
        return new InvestigationResponse(
                result.sessionId(),
                result.userQuery(),
                result.status().name(),
                result.objectiveStatus().name(),
                result.forcedAcceptance(),
                result.retries(),
                result.maxRetries(),
                result.executionPasses(),
                result.devices().values().stream().map(DeviceResponse::from).toList(),
                result.isFinished() ? result.summary() : null,
                result.errors());
    }
}
