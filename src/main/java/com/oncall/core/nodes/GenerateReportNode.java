package com.oncall.core.nodes;

import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.learning.LearningService;
import com.oncall.core.model.LearningInsights;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.report.ReportSynthesizer;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes the final summary and records what the session taught us.
 */
@Component
public class GenerateReportNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateReportNode.class);

    private final ReportSynthesizer synthesizer;
    private final LearningService learningService;
    private final EventBus eventBus;

    public GenerateReportNode(ReportSynthesizer synthesizer, LearningService learningService, EventBus eventBus) {
        this.synthesizer = synthesizer;
        this.learningService = learningService;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        String summary = synthesizer.synthesize(state);
        log.info("Report generated ({} chars)", summary.length());

        LearningInsights insights = learningService.record(state.sessionId(), state.userQuery(), summary);
        eventBus.publish(InvestigationEvent.of("session.reported", state.sessionId(), null,
                Map.of("learnedPatterns", insights.learnedPatterns().size(),
                        "deviceRelationships", insights.deviceRelationships().size())));

        return Map.of(
                "summary", summary,
                "status", SessionStatus.DONE.name()
        );
    }
}
