package com.oncall.core.oracle;

import com.oncall.core.model.StepOutcome;

import java.util.List;

/**
 * Everything the oracle sees when translating one plan step into tool calls.
 *
 * @param deviceName device under investigation
 * @param deviceProfile device class or platform
 * @param instruction the plan step to realise
 * @param objective objective of the whole investigation
 * @param retryFeedback assessor guidance from the previous pass, or null
 * @param priorOutcomes outcomes recorded so far for this device, across passes
 * @param learnedContext historical context from earlier sessions, may be empty
 */
public record OracleRequest(
    String deviceName,
    String deviceProfile,
    String instruction,
    String objective,
    String retryFeedback,
    List<StepOutcome> priorOutcomes,
    String learnedContext
) {
}
