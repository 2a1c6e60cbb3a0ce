package com.oncall.core.engine;

import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.state.InvestigationState;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a session: final once {@code status} is DONE or CANCELLED.
 */
public record InvestigationResult(
    String sessionId,
    String userQuery,
    SessionStatus status,
    ObjectiveStatus objectiveStatus,
    String summary,
    int retries,
    int maxRetries,
    int executionPasses,
    boolean forcedAcceptance,
    Map<String, DeviceInvestigationState> devices,
    List<String> errors
) {

    public static InvestigationResult from(InvestigationState state) {
        return new InvestigationResult(
                state.sessionId(),
                state.userQuery(),
                state.status(),
                state.objectiveStatus(),
                state.summary(),
                state.currentRetryCount(),
                state.maxRetries(),
                state.executionPasses(),
                state.forcedAcceptance(),
                state.devices(),
                List.copyOf(state.errors()));
    }

    public boolean isFinished() {
        return status == SessionStatus.DONE || status == SessionStatus.CANCELLED;
    }
}
