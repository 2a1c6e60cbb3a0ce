package com.oncall.core.nodes;

import com.oncall.core.error.InvalidTargetException;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.learning.LearningService;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.model.TargetDevice;
import com.oncall.core.state.InvestigationState;
import com.oncall.core.validation.TargetResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves the query into target devices and loads historical context.
 * A query naming no investigable device ends the session with {@link InvalidTargetException}.
 */
@Component
public class ValidateInputNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateInputNode.class);

    private final TargetResolver targetResolver;
    private final LearningService learningService;
    private final EventBus eventBus;

    public ValidateInputNode(TargetResolver targetResolver, LearningService learningService, EventBus eventBus) {
        this.targetResolver = targetResolver;
        this.learningService = learningService;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        String query = state.userQuery();
        if (query.isBlank()) {
            throw new InvalidTargetException("Query is empty");
        }
        String learnedContext = learningService.historicalContext();

        List<TargetDevice> targets = targetResolver.resolve(query, learnedContext);
        if (targets == null || targets.isEmpty()) {
            throw new InvalidTargetException("No investigable device found in query: " + query);
        }
        log.info("Validated query: {} target device(s)", targets.size());

        eventBus.publish(InvestigationEvent.of("session.validated", state.sessionId(), null,
                Map.of("devices", targets.stream().map(TargetDevice::deviceName).toList())));

        return Map.of(
                "targets", new ArrayList<>(targets),
                "learnedContext", learnedContext,
                "status", SessionStatus.PLANNING.name()
        );
    }
}
