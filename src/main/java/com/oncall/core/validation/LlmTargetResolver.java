package com.oncall.core.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.llm.LlmService;
import com.oncall.core.model.TargetDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts target devices from the query with the model, then checks them against
 * the configured inventory when one is set.
 */
@Component
public class LlmTargetResolver implements TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(LlmTargetResolver.class);

    static final String SYSTEM_PROMPT = """
            You are a network operations assistant. Extract every network device the user's
            query refers to.

            For each device return:
            - device_name: the device identifier exactly as it should be addressed, with no extra tags
            - device_profile: the device type or platform if it can be determined, otherwise empty
            - role: the device's role in the question (for example "edge router", "spine"), otherwise empty

            If an inventory is given, only return devices present in it and use the inventory spelling.
            If no device is referenced, return an empty list.
            """;

    public record ExtractedDevices(@JsonProperty("devices") List<TargetDevice> devices) {}

    private final LlmService llmService;
    private final InvestigatorProperties properties;

    public LlmTargetResolver(LlmService llmService, InvestigatorProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public List<TargetDevice> resolve(String userQuery, String learnedContext) {
        List<String> inventory = properties.getInventory().getDevices();
        var userPrompt = new StringBuilder("User query: ").append(userQuery).append("\n");
        if (!inventory.isEmpty()) {
            userPrompt.append("\nInventory:\n");
            inventory.forEach(d -> userPrompt.append("- ").append(d).append("\n"));
        }
        if (learnedContext != null && !learnedContext.isBlank()) {
            userPrompt.append("\nHistorical context:\n").append(learnedContext).append("\n");
        }

        ExtractedDevices extracted = llmService.structuredCall(
                SYSTEM_PROMPT, userPrompt.toString(), ExtractedDevices.class);
        List<TargetDevice> candidates = extracted != null && extracted.devices() != null
                ? extracted.devices() : List.of();
        List<TargetDevice> resolved = filter(candidates, inventory);
        log.info("Resolved {} device(s) from query: {}", resolved.size(),
                resolved.stream().map(TargetDevice::deviceName).toList());
        return resolved;
    }

    /**
     * Drops blank names and duplicates, and, with a non-empty inventory, anything not in it.
     * Inventory matching ignores case and yields the inventory spelling.
     */
    static List<TargetDevice> filter(List<TargetDevice> candidates, List<String> inventory) {
        Map<String, String> canonical = new LinkedHashMap<>();
        for (String name : inventory) {
            canonical.put(name.toLowerCase(Locale.ROOT), name);
        }
        var seen = new LinkedHashMap<String, TargetDevice>();
        for (TargetDevice device : candidates) {
            if (device == null || device.deviceName() == null || device.deviceName().isBlank()) {
                continue;
            }
            String name = device.deviceName().trim();
            if (!canonical.isEmpty()) {
                String known = canonical.get(name.toLowerCase(Locale.ROOT));
                if (known == null) {
                    log.warn("Device '{}' is not in the inventory, ignoring it", name);
                    continue;
                }
                name = known;
            }
            seen.putIfAbsent(name, new TargetDevice(name, device.deviceProfile(), device.role()));
        }
        return new ArrayList<>(seen.values());
    }
}
