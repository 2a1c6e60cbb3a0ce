package com.oncall.core.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.error.PlanDocumentException;
import com.oncall.core.model.InvestigationPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads investigation plans from {@code <intent>.json} documents.
 * <p>
 * The location is either a Spring resource prefix ({@code classpath:plans/}) or a
 * plain filesystem directory. Loaded plans are cached; a document is read at most once.
 * <pre>
 * {
 *   "intent": "interface_status",
 *   "description": "Determine operational state and error counters of all interfaces",
 *   "steps": ["List all interfaces", "Show error counters for interfaces that are down"]
 * }
 * </pre>
 */
@Component
public class PlanRepository {

    private static final Logger log = LoggerFactory.getLogger(PlanRepository.class);
    private static final Pattern INTENT_KEY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");
    private static final String SUFFIX = ".json";

    private final String location;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final Map<String, InvestigationPlan> cache = new ConcurrentHashMap<>();

    @Autowired
    public PlanRepository(InvestigatorProperties properties) {
        this(properties.getPlans().getLocation());
    }

    PlanRepository(String location) {
        this.location = normalizeLocation(location);
    }

    /**
     * Returns the plan for an intent key.
     *
     * @throws PlanDocumentException if the intent is unknown or its document is malformed
     */
    public InvestigationPlan load(String intent) {
        if (intent == null || !INTENT_KEY.matcher(intent).matches()) {
            throw new PlanDocumentException("Invalid plan intent: '" + intent + "'");
        }
        return cache.computeIfAbsent(intent, this::readPlan);
    }

    /**
     * Every readable plan at the configured location, sorted by intent.
     * Malformed documents are skipped with a warning; loading one explicitly still fails.
     */
    public List<InvestigationPlan> catalog() {
        var plans = new ArrayList<InvestigationPlan>();
        for (String intent : listIntents()) {
            try {
                plans.add(load(intent));
            } catch (PlanDocumentException e) {
                log.warn("Skipping plan '{}': {}", intent, e.getMessage());
            }
        }
        plans.sort(Comparator.comparing(InvestigationPlan::intent));
        return plans;
    }

    public List<String> listIntents() {
        try {
            Resource[] resources = resolver.getResources(location + "*" + SUFFIX);
            var intents = new ArrayList<String>();
            for (Resource resource : resources) {
                String filename = resource.getFilename();
                if (filename != null && filename.endsWith(SUFFIX)) {
                    intents.add(filename.substring(0, filename.length() - SUFFIX.length()));
                }
            }
            intents.sort(String::compareTo);
            return intents;
        } catch (IOException e) {
            throw new PlanDocumentException("Cannot list plans at " + location, e);
        }
    }

    private InvestigationPlan readPlan(String intent) {
        Resource resource = resolver.getResource(location + intent + SUFFIX);
        if (!resource.exists()) {
            throw new PlanDocumentException("Unknown plan intent '" + intent + "' (no document at "
                    + location + intent + SUFFIX + ")");
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new PlanDocumentException("Plan '" + intent + "' is not valid JSON: " + e.getMessage(), e);
        }
        InvestigationPlan plan = parse(intent, root);
        log.info("Loaded plan '{}' with {} step(s)", intent, plan.steps().size());
        return plan;
    }

    static InvestigationPlan parse(String expectedIntent, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PlanDocumentException("Plan '" + expectedIntent + "' must be a JSON object");
        }
        String intent = requireText(root, "intent", expectedIntent);
        if (!intent.equals(expectedIntent)) {
            throw new PlanDocumentException("Plan document " + expectedIntent + SUFFIX
                    + " declares intent '" + intent + "'");
        }
        String description = requireText(root, "description", expectedIntent);

        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray() || stepsNode.isEmpty()) {
            throw new PlanDocumentException("Plan '" + expectedIntent + "' must have a non-empty 'steps' array");
        }
        var steps = new ArrayList<String>();
        for (JsonNode step : stepsNode) {
            if (!step.isTextual() || step.asText().isBlank()) {
                throw new PlanDocumentException("Plan '" + expectedIntent + "' has a blank or non-text step");
            }
            steps.add(step.asText().trim());
        }
        return new InvestigationPlan(intent, description, steps);
    }

    private static String requireText(JsonNode root, String field, String intent) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new PlanDocumentException("Plan '" + intent + "' is missing required field '" + field + "'");
        }
        return node.asText().trim();
    }

    private static String normalizeLocation(String location) {
        String loc = location == null || location.isBlank() ? "classpath:plans/" : location.trim();
        if (!loc.contains(":") || loc.matches("^[A-Za-z]:[\\\\/].*")) {
            loc = "file:" + loc;
        }
        return loc.endsWith("/") ? loc : loc + "/";
    }
}
