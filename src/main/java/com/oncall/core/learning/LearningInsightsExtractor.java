package com.oncall.core.learning;

import com.oncall.core.llm.LlmService;
import com.oncall.core.model.LearningInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Distils reusable patterns and device relationships out of a finished report.
 */
@Component
public class LearningInsightsExtractor {

    private static final Logger log = LoggerFactory.getLogger(LearningInsightsExtractor.class);

    static final String SYSTEM_PROMPT = """
            You are a network expert reviewing a finished device investigation. Extract insights
            that would help future investigations.

            learned_patterns: technical patterns or behaviours discovered (configuration patterns per
            device role, typical operational state, troubleshooting approaches that worked).
            device_relationships: relationships between devices (adjacencies, BGP or IGP peerings,
            dependencies, traffic flow).

            Keep each entry to one clear sentence with the relevant technical detail.
            If nothing significant was found, return empty lists.
            """;

    private final LlmService llmService;

    public LearningInsightsExtractor(LlmService llmService) {
        this.llmService = llmService;
    }

    /**
     * @return extracted insights, or empty insights if the model call fails
     */
    public LearningInsights extract(String userQuery, String report) {
        try {
            LearningInsights insights = llmService.structuredCall(SYSTEM_PROMPT,
                    "User query: " + userQuery + "\n\nInvestigation report:\n" + report,
                    LearningInsights.class);
            return insights != null ? insights : LearningInsights.empty();
        } catch (RuntimeException e) {
            log.warn("Learning insight extraction failed: {}", e.getMessage());
            return LearningInsights.empty();
        }
    }
}
