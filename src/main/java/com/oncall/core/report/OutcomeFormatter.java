package com.oncall.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oncall.core.model.DeviceInvestigationState;
import com.oncall.core.model.StepOutcome;
import com.oncall.core.model.ToolInvocation;

import java.util.Map;

/**
 * Markdown rendering of a device's investigation history, shared by the judge,
 * the report and the learning prompts.
 */
public final class OutcomeFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OutcomeFormatter() {}

    public static String describeDevice(DeviceInvestigationState device, int maxResultChars) {
        var sb = new StringBuilder();
        sb.append("### ").append(device.deviceName()).append("\n");
        sb.append("- Profile: ").append(device.deviceProfile()).append("\n");
        if (device.role() != null && !device.role().isEmpty()) {
            sb.append("- Role: ").append(device.role()).append("\n");
        }
        sb.append("- Plan: ").append(device.intent()).append("\n");
        sb.append("- Objective: ").append(device.objective()).append("\n");
        sb.append("- Status: ").append(device.status()).append(" after ").append(device.attempts())
          .append(" pass(es)\n");
        if (device.errorDetails() != null) {
            sb.append("- Error: ").append(device.errorDetails()).append("\n");
        }
        if (device.limitationsNotes() != null) {
            sb.append("- Limitations:\n");
            for (String line : device.limitationsNotes().split("\n")) {
                sb.append("  - ").append(line).append("\n");
            }
        }
        if (device.stepOutcomes().isEmpty()) {
            sb.append("- No steps executed\n");
            return sb.toString();
        }
        sb.append("\n");
        for (StepOutcome outcome : device.stepOutcomes()) {
            appendOutcome(sb, outcome, maxResultChars);
        }
        return sb.toString();
    }

    static void appendOutcome(StringBuilder sb, StepOutcome outcome, int maxResultChars) {
        sb.append("**Pass ").append(outcome.attempt()).append(", step ").append(outcome.stepIndex() + 1)
          .append(":** ").append(outcome.instruction()).append("\n");
        if (outcome.invocations().isEmpty()) {
            sb.append("- no tool calls\n");
        }
        for (ToolInvocation invocation : outcome.invocations()) {
            sb.append("- `").append(invocation.functionName()).append("` ");
            if (!invocation.parameters().isEmpty()) {
                sb.append(toJson(invocation.parameters(), 200)).append(" ");
            }
            if (invocation.error() != null) {
                sb.append("failed (").append(invocation.error().type()).append("): ")
                  .append(invocation.error().message());
            } else if (invocation.result() != null) {
                sb.append("returned ").append(toJson(invocation.result(), maxResultChars));
            } else {
                sb.append("not executed");
            }
            sb.append("\n");
        }
    }

    public static String toJson(Map<String, Object> value, int maxChars) {
        String text;
        try {
            text = MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            text = String.valueOf(value);
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "...(truncated)" : text;
    }
}
