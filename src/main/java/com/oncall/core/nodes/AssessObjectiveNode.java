package com.oncall.core.nodes;

import com.oncall.core.assessment.ObjectiveAssessor;
import com.oncall.core.assessment.ObjectiveJudge;
import com.oncall.core.events.EventBus;
import com.oncall.core.events.InvestigationEvent;
import com.oncall.core.metrics.InvestigationMetrics;
import com.oncall.core.model.Assessment;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.DeviceVerdict;
import com.oncall.core.model.ObjectiveJudgement;
import com.oncall.core.model.ObjectiveStatus;
import com.oncall.core.model.SessionStatus;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Judges the unresolved devices and applies the retry policy.
 * <p>
 * On a retry decision the retry count is incremented and feedback is stored on the
 * devices that need another pass; settled devices are recorded as resolved and are
 * not executed again.
 */
@Component
public class AssessObjectiveNode {

    private static final Logger log = LoggerFactory.getLogger(AssessObjectiveNode.class);

    static final String ASSESSMENT_ERROR_FEEDBACK =
            "An unexpected error occurred during assessment. Try a different approach.";

    private final ObjectiveJudge judge;
    private final ObjectiveAssessor assessor;
    private final InvestigationMetrics metrics;
    private final EventBus eventBus;

    public AssessObjectiveNode(ObjectiveJudge judge, ObjectiveAssessor assessor,
                               InvestigationMetrics metrics, EventBus eventBus) {
        this.judge = judge;
        this.assessor = assessor;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(InvestigationState state) {
        var judgements = new LinkedHashMap<String, ObjectiveJudgement>();
        for (DeviceInvestigationState device : state.unresolvedDevices()) {
            ObjectiveJudgement judgement = judgeSafely(state, device);
            judgements.put(device.deviceName(), judgement);
            metrics.recordVerdict(judgement.verdict());
        }

        int retries = state.currentRetryCount();
        Assessment assessment = assessor.assess(judgements, retries, state.maxRetries());

        Map<String, String> resolved = state.resolvedDevices();
        resolved.putAll(assessment.resolutions());

        var updates = new HashMap<String, Object>();
        updates.put("resolvedDevices", resolved);
        updates.put("assessorNotes", assessment.notes());

        if (assessment.objectiveAchieved()) {
            if (assessment.forced()) {
                log.warn("Retry bound reached after {} pass(es), forcing acceptance", state.executionPasses());
                metrics.recordForcedAcceptance();
            } else {
                log.info("Objective achieved after {} pass(es)", state.executionPasses());
            }
            updates.put("objectiveStatus", ObjectiveStatus.ACHIEVED.name());
            updates.put("forcedAcceptance", assessment.forced());
            updates.put("status", SessionStatus.REPORTING.name());
        } else {
            Map<String, DeviceInvestigationState> devices = state.devices();
            assessment.feedbackPerDevice().forEach((name, feedback) ->
                    devices.computeIfPresent(name, (k, d) -> d.withRetryFeedback(feedback)));
            log.info("Objective not achieved, retrying {} device(s) (retry {}/{})",
                    assessment.feedbackPerDevice().size(), retries + 1, state.maxRetries());
            updates.put("devices", devices);
            updates.put("currentRetryCount", retries + 1);
            updates.put("objectiveStatus", ObjectiveStatus.NOT_ACHIEVED.name());
            updates.put("status", SessionStatus.EXECUTING.name());
        }

        eventBus.publish(InvestigationEvent.of("session.assessed", state.sessionId(), null,
                Map.of("achieved", assessment.objectiveAchieved(),
                        "forced", assessment.forced(),
                        "retryDevices", assessment.feedbackPerDevice().keySet().stream().sorted().toList())));
        return updates;
    }

    private ObjectiveJudgement judgeSafely(InvestigationState state, DeviceInvestigationState device) {
        try {
            ObjectiveJudgement judgement = judge.judge(state.userQuery(), device, state.learnedContext());
            if (judgement == null || judgement.verdict() == null) {
                return ObjectiveJudgement.unmet("Assessment returned no verdict", null);
            }
            return judgement;
        } catch (RuntimeException e) {
            log.warn("Assessment of {} failed: {}", device.deviceName(), e.getMessage());
            return new ObjectiveJudgement(DeviceVerdict.UNMET,
                    "Assessment encountered an error: " + e.getMessage(), ASSESSMENT_ERROR_FEEDBACK);
        }
    }
}
