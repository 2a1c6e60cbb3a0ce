package com.oncall.core.investigation;

import com.oncall.core.metrics.InvestigationMetrics;
import com.oncall.core.model.DeviceAssignment;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.StepOutcome;
import com.oncall.core.model.ToolCallRequest;
import com.oncall.core.model.ToolError;
import com.oncall.core.model.ToolErrorType;
import com.oncall.core.model.ToolInvocation;
import com.oncall.core.oracle.OracleRequest;
import com.oncall.core.oracle.ReasoningOracle;
import com.oncall.core.tools.ToolExecutionException;
import com.oncall.core.tools.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs one device's plan for one execution pass.
 * <p>
 * Steps run strictly in order. A step whose tools fail, or for which no tool fits,
 * is recorded and the next step still runs; the gaps end up in the limitations notes.
 * An unexpected runtime error from the tool executor is recorded against that call only.
 */
@Component
public class DeviceInvestigator {

    private static final Logger log = LoggerFactory.getLogger(DeviceInvestigator.class);

    private final ReasoningOracle oracle;
    private final ToolExecutor toolExecutor;
    private final InvestigationMetrics metrics;

    public DeviceInvestigator(ReasoningOracle oracle, ToolExecutor toolExecutor, InvestigationMetrics metrics) {
        this.oracle = oracle;
        this.toolExecutor = toolExecutor;
        this.metrics = metrics;
    }

    public DeviceInvestigationState run(DeviceAssignment assignment, CancellationToken token) {
        return run(assignment, token, partial -> { });
    }

    /**
     * Runs the pass, handing {@code onStep} the device as it would stand if the pass were
     * cut off after each finished step.
     */
    public DeviceInvestigationState run(DeviceAssignment assignment, CancellationToken token,
                                        Consumer<DeviceInvestigationState> onStep) {
        DeviceInvestigationState device = assignment.device();
        List<String> steps = device.planSteps();
        var history = new ArrayList<>(device.stepOutcomes());
        var newOutcomes = new ArrayList<StepOutcome>();
        var limitations = new ArrayList<String>();

        log.info("Investigating {} (pass {}, {} step(s))", device.deviceName(), assignment.attempt(), steps.size());

        for (int i = 0; i < steps.size(); i++) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                log.info("Investigation of {} cancelled before step {}", device.deviceName(), i + 1);
                limitations.add("Cancelled before step " + (i + 1) + " of " + steps.size());
                return device.cancelledPass(newOutcomes, joinNotes(limitations));
            }
            String instruction = steps.get(i);
            StepOutcome outcome = runStep(assignment, i, instruction, List.copyOf(history), limitations);
            newOutcomes.add(outcome);
            history.add(outcome);
            onStep.accept(device.cancelledPass(newOutcomes,
                    joinNotes(withNote(limitations, "Interrupted after step " + (i + 1) + " of " + steps.size()))));
        }

        log.info("Investigation of {} finished pass {} with {} limitation(s)",
                device.deviceName(), assignment.attempt(), limitations.size());
        return device.completedPass(newOutcomes, joinNotes(limitations));
    }

    private StepOutcome runStep(DeviceAssignment assignment, int index, String instruction,
                                List<StepOutcome> priorOutcomes, List<String> limitations) {
        DeviceInvestigationState device = assignment.device();
        String label = "Step " + (index + 1) + " (" + instruction + ")";

        List<ToolCallRequest> calls;
        try {
            calls = oracle.propose(new OracleRequest(
                    device.deviceName(), device.deviceProfile(), instruction, device.objective(),
                    device.retryFeedback(), priorOutcomes, assignment.learnedContext()));
        } catch (RuntimeException e) {
            log.warn("Reasoning failed for {} on {}: {}", label, device.deviceName(), e.getMessage());
            limitations.add(label + ": reasoning failed: " + e.getMessage());
            return new StepOutcome(assignment.attempt(), index, instruction, List.of());
        }

        if (calls == null || calls.isEmpty()) {
            limitations.add(label + ": no applicable tool");
            return new StepOutcome(assignment.attempt(), index, instruction, List.of());
        }

        var invocations = new ArrayList<ToolInvocation>();
        for (ToolCallRequest call : calls) {
            invocations.add(invoke(call, device.deviceName()));
        }
        var outcome = new StepOutcome(assignment.attempt(), index, instruction, invocations);

        List<ToolInvocation> failed = outcome.failedInvocations();
        if (!failed.isEmpty()) {
            String errors = failed.stream()
                    .map(f -> f.functionName() + " " + f.error().type() + ": " + f.error().message())
                    .collect(Collectors.joining("; "));
            limitations.add(label + (outcome.hasSuccessfulInvocation() ? ": partial failure: " : ": all calls failed: ")
                    + errors);
        }
        return outcome;
    }

    private ToolInvocation invoke(ToolCallRequest call, String deviceName) {
        try {
            return ToolInvocation.succeeded(call, toolExecutor.execute(call, deviceName));
        } catch (ToolExecutionException e) {
            log.warn("Tool {} failed on {}: {} {}", call.functionName(), deviceName, e.getType(), e.getMessage());
            metrics.recordToolError(e.getType());
            return ToolInvocation.failed(call, e.toToolError());
        } catch (RuntimeException e) {
            log.error("Tool {} crashed on {}: {}", call.functionName(), deviceName, e.toString(), e);
            metrics.recordToolError(ToolErrorType.PROTOCOL);
            return ToolInvocation.failed(call, new ToolError(ToolErrorType.PROTOCOL,
                    "unexpected executor error: " + e));
        }
    }

    private static List<String> withNote(List<String> notes, String note) {
        var copy = new ArrayList<>(notes);
        copy.add(note);
        return copy;
    }

    private static String joinNotes(List<String> notes) {
        return notes.isEmpty() ? null : String.join("\n", notes);
    }
}
