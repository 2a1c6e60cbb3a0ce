package com.oncall.core.model;

import java.io.Serializable;

/**
 * Verdict for a single device, as returned by an objective judge.
 *
 * @param verdict whether the objective was met
 * @param notes free-text explanation for the report
 * @param feedback guidance for the next attempt, only meaningful for {@link DeviceVerdict#UNMET}
 */
public record ObjectiveJudgement(
    DeviceVerdict verdict,
    String notes,
    String feedback
) implements Serializable {

    public static ObjectiveJudgement met(String notes) {
        return new ObjectiveJudgement(DeviceVerdict.MET, notes, null);
    }

    public static ObjectiveJudgement limited(String notes) {
        return new ObjectiveJudgement(DeviceVerdict.LIMITED, notes, null);
    }

    public static ObjectiveJudgement unmet(String notes, String feedback) {
        return new ObjectiveJudgement(DeviceVerdict.UNMET, notes, feedback);
    }
}
