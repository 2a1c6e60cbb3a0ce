package com.oncall.core.assessment;

import com.oncall.core.llm.LlmService;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.ObjectiveJudgement;
import com.oncall.core.report.OutcomeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Judges a device's results against its objective with the model.
 */
@Component
public class LlmObjectiveJudge implements ObjectiveJudge {

    private static final Logger log = LoggerFactory.getLogger(LlmObjectiveJudge.class);
    private static final int MAX_RESULT_CHARS = 3000;

    static final String SYSTEM_PROMPT = """
            You are an expert network operations analyst. Decide whether the investigation of ONE
            device gathered enough to meet its objective and to answer the user's question for that device.

            Return one verdict:
            - MET: the objective is met; the question can be answered from the results.
            - LIMITED: the objective cannot be fully met because of tool or device capability
              (for example FEATURE_NOT_FOUND, "not available", unsupported command). This is a valid
              outcome, not a failure; another attempt would not change it.
            - UNMET: the objective is not met and another attempt could reasonably fix it
              (missing data, wrong tool choice, transient communication errors).

            notes: a concise assessment for the final report, including limitations you identified.
            feedback: only for UNMET, concrete guidance on what the next attempt must gather or do differently.
            """;

    private final LlmService llmService;

    public LlmObjectiveJudge(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ObjectiveJudgement judge(String userQuery, DeviceInvestigationState device, String learnedContext) {
        var userPrompt = new StringBuilder();
        userPrompt.append("User query: ").append(userQuery).append("\n\n");
        userPrompt.append(OutcomeFormatter.describeDevice(device, MAX_RESULT_CHARS));
        if (learnedContext != null && !learnedContext.isBlank()) {
            userPrompt.append("\nHistorical context:\n").append(learnedContext).append("\n");
        }
        ObjectiveJudgement judgement = llmService.structuredCall(
                SYSTEM_PROMPT, userPrompt.toString(), ObjectiveJudgement.class);
        log.info("Judged {}: {}", device.deviceName(), judgement != null ? judgement.verdict() : null);
        return judgement;
    }
}
