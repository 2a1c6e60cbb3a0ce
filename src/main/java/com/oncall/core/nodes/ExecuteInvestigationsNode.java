package com.oncall.core.nodes;

import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.investigation.CancellationRegistry;
import com.oncall.core.investigation.CancellationToken;
import com.oncall.core.investigation.FanOutCoordinator;
import com.oncall.core.investigation.SessionProgress;
import com.oncall.core.model.DeviceAssignment;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.InvestigationStatus;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs one execution pass over every device not yet resolved by the assessor.
 */
@Component
public class ExecuteInvestigationsNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteInvestigationsNode.class);

    private final FanOutCoordinator coordinator;
    private final CancellationRegistry cancellations;
    private final EventBus eventBus;

    public ExecuteInvestigationsNode(FanOutCoordinator coordinator, CancellationRegistry cancellations,
                                     EventBus eventBus) {
        this.coordinator = coordinator;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        int pass = state.executionPasses() + 1;
        String sessionId = state.sessionId();
        CancellationToken token = cancellations.tokenFor(sessionId);
        SessionProgress progress = cancellations.progressFor(sessionId);
        progress.recordAll(state.devices());
        if (token.isCancelled()) {
            log.info("Session cancelled before pass {}", pass);
            return Map.of("status", SessionStatus.CANCELLED.name());
        }

        List<DeviceAssignment> assignments = state.unresolvedDevices().stream()
                .map(d -> new DeviceAssignment(d, pass, state.learnedContext()))
                .toList();
        log.info("Execution pass {} over {} device(s) (retry {}/{})",
                pass, assignments.size(), state.currentRetryCount(), state.maxRetries());
        eventBus.publish(InvestigationEvent.of("pass.started", sessionId, null,
                Map.of("pass", pass, "devices", assignments.stream().map(DeviceAssignment::deviceName).toList())));

        progress.recordPass(pass);
        Map<String, DeviceInvestigationState> results = coordinator.runAll(sessionId, assignments, token, progress);

        Map<String, DeviceInvestigationState> devices = state.devices();
        devices.putAll(results);

        boolean cancelled = token.isCancelled()
                || results.values().stream().anyMatch(d -> d.status() == InvestigationStatus.CANCELLED);
        eventBus.publish(InvestigationEvent.of("pass.completed", sessionId, null,
                Map.of("pass", pass, "cancelled", cancelled)));

        return Map.of(
                "devices", devices,
                "executionPasses", pass,
                "objectiveStatus", ObjectiveStatus.UNKNOWN.name(),
                "status", cancelled ? SessionStatus.CANCELLED.name() : SessionStatus.ASSESSING.name()
        );
    }
}
