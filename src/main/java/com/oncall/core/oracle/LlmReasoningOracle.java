package com.oncall.core.oracle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oncall.core.llm.LlmService;
import com.oncall.core.model.StepOutcome;
import com.oncall.core.model.ToolCallRequest;
import com.oncall.core.model.ToolInvocation;
import com.oncall.core.tools.ToolCatalog;
import com.oncall.core.tools.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the model which catalog tools realise a plan step on a given device.
 * Proposals naming tools outside the catalog are dropped.
 */
@Component
public class LlmReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(LlmReasoningOracle.class);
    private static final int MAX_RESULT_CHARS = 1500;

    static final String SYSTEM_PROMPT = """
            You are a network operations agent carrying out ONE step of an investigation plan
            on ONE specific device. Do not target any other device.

            Choose the tool calls from the available tools that gather the data this step asks for.
            Prefer detailed output options when a tool offers them. Use the results of earlier steps
            to avoid repeating calls that already succeeded, and to fill in arguments.

            If feedback from a previous attempt is given, address it first: it names what was missing.

            If no available tool can serve this step, return an empty list of calls.
            The device name is passed to every tool automatically; do not add it yourself.
            """;

    public record ProposedCalls(@JsonProperty("calls") List<ProposedCall> calls) {}

    public record ProposedCall(
        @JsonProperty("function_name") String functionName,
        @JsonProperty("parameters") Map<String, Object> parameters
    ) {}

    private final LlmService llmService;
    private final ToolCatalog toolCatalog;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LlmReasoningOracle(LlmService llmService, ToolCatalog toolCatalog) {
        this.llmService = llmService;
        this.toolCatalog = toolCatalog;
    }

    @Override
    public List<ToolCallRequest> propose(OracleRequest request) {
        List<ToolDescriptor> tools = toolCatalog.availableTools();
        if (tools.isEmpty()) {
            log.warn("No tools available for step '{}' on {}", request.instruction(), request.deviceName());
            return List.of();
        }
        ProposedCalls proposed = llmService.structuredCall(SYSTEM_PROMPT, buildUserPrompt(request, tools),
                ProposedCalls.class);
        if (proposed == null || proposed.calls() == null) {
            return List.of();
        }

        Set<String> known = tools.stream().map(ToolDescriptor::name).collect(Collectors.toSet());
        var calls = new ArrayList<ToolCallRequest>();
        for (ProposedCall call : proposed.calls()) {
            if (call == null || call.functionName() == null || !known.contains(call.functionName())) {
                log.warn("Dropping proposal for unknown tool: {}", call != null ? call.functionName() : null);
                continue;
            }
            calls.add(new ToolCallRequest(call.functionName(), call.parameters()));
        }
        log.debug("Oracle proposed {} call(s) for step '{}'", calls.size(), request.instruction());
        return calls;
    }

    String buildUserPrompt(OracleRequest request, List<ToolDescriptor> tools) {
        var sb = new StringBuilder();
        sb.append("Device: ").append(request.deviceName())
          .append(" (profile: ").append(request.deviceProfile()).append(")\n");
        sb.append("Objective: ").append(request.objective()).append("\n");
        sb.append("Current step: ").append(request.instruction()).append("\n");
        if (request.retryFeedback() != null && !request.retryFeedback().isBlank()) {
            sb.append("\nFeedback from previous attempt:\n").append(request.retryFeedback()).append("\n");
        }

        sb.append("\nAvailable tools:\n");
        for (ToolDescriptor tool : tools) {
            sb.append("- ").append(tool.name()).append(": ").append(tool.description()).append("\n");
            if (tool.inputSchema() != null && !tool.inputSchema().isBlank()) {
                sb.append("  arguments: ").append(tool.inputSchema()).append("\n");
            }
        }

        if (!request.priorOutcomes().isEmpty()) {
            sb.append("\nResults so far:\n");
            for (StepOutcome outcome : request.priorOutcomes()) {
                sb.append("[pass ").append(outcome.attempt()).append(", step ").append(outcome.stepIndex() + 1)
                  .append("] ").append(outcome.instruction()).append("\n");
                if (outcome.invocations().isEmpty()) {
                    sb.append("  (no tool calls)\n");
                }
                for (ToolInvocation invocation : outcome.invocations()) {
                    sb.append("  ").append(invocation.functionName()).append(invocation.parameters()).append(" -> ");
                    if (invocation.error() != null) {
                        sb.append("ERROR ").append(invocation.error().type()).append(": ")
                          .append(invocation.error().message());
                    } else {
                        sb.append(abbreviate(invocation.result()));
                    }
                    sb.append("\n");
                }
            }
        }
        if (request.learnedContext() != null && !request.learnedContext().isBlank()) {
            sb.append("\nHistorical context:\n").append(request.learnedContext()).append("\n");
        }
        return sb.toString();
    }

    private String abbreviate(Map<String, Object> result) {
        String text;
        try {
            text = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            text = String.valueOf(result);
        }
        return text.length() > MAX_RESULT_CHARS ? text.substring(0, MAX_RESULT_CHARS) + "...(truncated)" : text;
    }
}
