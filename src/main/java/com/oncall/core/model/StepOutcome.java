package com.oncall.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Record of one plan step executed during one execution pass.
 *
 * @param attempt 1-based execution pass that produced this outcome
 * @param stepIndex 0-based position of the step within the plan
 * @param instruction the plan step text
 * @param invocations tool calls made for this step, possibly none
 */
public record StepOutcome(
    int attempt,
    int stepIndex,
    String instruction,
    List<ToolInvocation> invocations
) implements Serializable {

    public StepOutcome {
        invocations = List.copyOf(invocations);
    }

    public boolean hasSuccessfulInvocation() {
        return invocations.stream().anyMatch(ToolInvocation::isSuccess);
    }

    public List<ToolInvocation> failedInvocations() {
        return invocations.stream().filter(i -> i.error() != null).toList();
    }
}
