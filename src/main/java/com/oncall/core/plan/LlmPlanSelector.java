package com.oncall.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oncall.core.llm.LlmService;
import com.oncall.core.model.InvestigationPlan;
import com.oncall.core.model.TargetDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the model to match each device against the plan catalog.
 */
@Component
public class LlmPlanSelector implements PlanSelector {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanSelector.class);

    static final String SYSTEM_PROMPT = """
            You are a network operations assistant planning a multi-device investigation.
            For every device listed, choose exactly one plan from the available plans by its intent key.
            Pick the plan whose objective best answers the user's question for that device,
            taking the device's profile and role into account.

            Also write a device-specific objective: a short statement of what the investigation
            must establish on THIS device. Keep it consistent with the chosen plan's description.

            Use the historical context, when present, to prefer plans that produced useful
            findings for similar questions before.

            Respond with one entry per device. Use the device name exactly as given.
            """;

    public record PlanSelection(@JsonProperty("plans") List<PlanChoice> plans) {}

    private final LlmService llmService;

    public LlmPlanSelector(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Map<String, PlanChoice> select(String userQuery, List<TargetDevice> devices,
                                          List<InvestigationPlan> catalog, String learnedContext) {
        String userPrompt = buildUserPrompt(userQuery, devices, catalog, learnedContext);
        PlanSelection selection = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, PlanSelection.class);

        Set<String> knownIntents = catalog.stream().map(InvestigationPlan::intent).collect(Collectors.toSet());
        Set<String> deviceNames = devices.stream().map(TargetDevice::deviceName).collect(Collectors.toSet());
        var choices = new LinkedHashMap<String, PlanChoice>();
        if (selection == null || selection.plans() == null) {
            return choices;
        }
        for (PlanChoice choice : selection.plans()) {
            if (choice == null || choice.deviceName() == null || !deviceNames.contains(choice.deviceName())) {
                log.warn("Ignoring plan choice for unknown device: {}", choice);
                continue;
            }
            if (!knownIntents.contains(choice.intent())) {
                log.warn("Model chose unknown intent '{}' for device {}", choice.intent(), choice.deviceName());
                continue;
            }
            choices.putIfAbsent(choice.deviceName(), choice);
        }
        return choices;
    }

    static String buildUserPrompt(String userQuery, List<TargetDevice> devices,
                                  List<InvestigationPlan> catalog, String learnedContext) {
        var sb = new StringBuilder();
        sb.append("User query: ").append(userQuery).append("\n\n");
        sb.append("Devices:\n");
        for (TargetDevice device : devices) {
            sb.append("- ").append(device.deviceName())
              .append(" (profile: ").append(device.deviceProfile());
            if (!device.role().isEmpty()) {
                sb.append(", role: ").append(device.role());
            }
            sb.append(")\n");
        }
        sb.append("\nAvailable plans:\n");
        for (InvestigationPlan plan : catalog) {
            sb.append("--- plan: ").append(plan.intent()).append(" ---\n");
            sb.append("Objective: ").append(plan.objectiveDescription()).append("\n");
            for (int i = 0; i < plan.steps().size(); i++) {
                sb.append(i + 1).append(". ").append(plan.steps().get(i)).append("\n");
            }
        }
        if (learnedContext != null && !learnedContext.isBlank()) {
            sb.append("\nHistorical context:\n").append(learnedContext).append("\n");
        }
        return sb.toString();
    }
}
