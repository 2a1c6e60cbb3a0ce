package com.oncall.core.nodes;

import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.investigation.CancellationRegistry;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.report.ReportRenderer;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Ends a cancelled session with a rendered partial report. No model call is made.
 */
@Component
public class CancelSessionNode {

    private static final Logger log = LoggerFactory.getLogger(CancelSessionNode.class);

    private final ReportRenderer renderer;
    private final CancellationRegistry cancellations;
    private final EventBus eventBus;

    public CancelSessionNode(ReportRenderer renderer, CancellationRegistry cancellations, EventBus eventBus) {
        this.renderer = renderer;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        log.info("Session {} cancelled after {} pass(es)", state.sessionId(), state.executionPasses());
        var cancelled = new HashMap<String, Object>(state.data());
        cancelled.put("objectiveStatus", ObjectiveStatus.CANCELLED.name());
        String reason = cancellations.tokenFor(state.sessionId()).reason();
        String summary = renderer.renderCancelled(new InvestigationState(cancelled), reason);

        eventBus.publish(InvestigationEvent.of("session.cancelled", state.sessionId(), null,
                Map.of("passes", state.executionPasses(), "reason", reason)));
        return Map.of(
                "summary", summary,
                "objectiveStatus", ObjectiveStatus.CANCELLED.name(),
                "status", SessionStatus.CANCELLED.name()
        );
    }
}
