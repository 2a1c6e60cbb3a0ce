package com.oncall.core.assessment;

import com.oncall.core.model.Assessment;
import com.oncall.core.model.DeviceVerdict;
import com.oncall.core.model.ObjectiveJudgement;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry policy applied to the per-device judgements of one assessment pass.
 * <p>
 * A device is settled when its verdict is {@link DeviceVerdict#MET} or
 * {@link DeviceVerdict#LIMITED}. The objective is achieved when every judged device is
 * settled. Otherwise unsettled devices get retry feedback while retries remain, and once
 * {@code currentRetryCount == maxRetries} acceptance is forced. This class holds no state;
 * incrementing the retry count is left to the caller.
 */
@Component
public class ObjectiveAssessor {

    public static final String DEFAULT_RETRY_GUIDANCE =
            "The assessment gave no specific guidance for improvement. Review what was gathered against "
            + "the original request and try a different approach, focusing on the gaps.";

    public static final String MAX_RETRIES_REACHED = "max retries reached";

    /**
     * @param judgements verdicts for the devices judged in this pass, keyed by device name
     * @param currentRetryCount retries already performed
     * @param maxRetries retry bound
     */
    public Assessment assess(Map<String, ObjectiveJudgement> judgements, int currentRetryCount, int maxRetries) {
        var feedback = new LinkedHashMap<String, String>();
        var resolutions = new LinkedHashMap<String, String>();
        var notes = new StringBuilder();

        for (var entry : judgements.entrySet()) {
            String device = entry.getKey();
            ObjectiveJudgement judgement = entry.getValue();
            DeviceVerdict verdict = judgement != null && judgement.verdict() != null
                    ? judgement.verdict() : DeviceVerdict.UNMET;
            String deviceNotes = judgement != null && judgement.notes() != null ? judgement.notes().trim() : "";

            switch (verdict) {
                case MET -> resolutions.put(device, "objective met" + suffix(deviceNotes));
                case LIMITED -> resolutions.put(device, "limited by device or tool capability" + suffix(deviceNotes));
                case UNMET -> {
                    String guidance = judgement != null && judgement.feedback() != null && !judgement.feedback().isBlank()
                            ? judgement.feedback().trim() : DEFAULT_RETRY_GUIDANCE;
                    feedback.put(device, guidance);
                }
            }
            notes.append("- ").append(device).append(": ").append(verdict);
            if (!deviceNotes.isEmpty()) {
                notes.append(" - ").append(deviceNotes);
            }
            notes.append("\n");
        }

        if (feedback.isEmpty()) {
            String summary = resolutions.values().stream().allMatch(r -> r.startsWith("objective met"))
                    ? "objective met" : "objective met within device limitations";
            return new Assessment(true, Map.of(), resolutions, summary + "\n" + notes, false);
        }

        if (currentRetryCount < maxRetries) {
            String summary = "objective not yet met on " + feedback.size() + " device(s), retry "
                    + (currentRetryCount + 1) + " of " + maxRetries;
            return new Assessment(false, feedback, resolutions, summary + "\n" + notes, false);
        }

        // Bound reached: accept what we have and record which devices fell short.
        for (String device : feedback.keySet()) {
            resolutions.put(device, MAX_RETRIES_REACHED);
        }
        String summary = "Objective not achieved after " + (currentRetryCount + 1) + " execution pass(es); "
                + MAX_RETRIES_REACHED + " (" + maxRetries + ")";
        return new Assessment(true, Map.of(), resolutions, summary + "\n" + notes, true);
    }

    private static String suffix(String notes) {
        return notes.isEmpty() ? "" : ": " + notes;
    }
}
