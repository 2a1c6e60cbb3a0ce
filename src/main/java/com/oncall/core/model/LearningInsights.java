package com.oncall.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Patterns extracted from a finished session.
 */
public record LearningInsights(
    @JsonProperty("learned_patterns") List<String> learnedPatterns,
    @JsonProperty("device_relationships") List<String> deviceRelationships
) implements Serializable {

    public LearningInsights {
        learnedPatterns = learnedPatterns != null ? List.copyOf(learnedPatterns) : List.of();
        deviceRelationships = deviceRelationships != null ? List.copyOf(deviceRelationships) : List.of();
    }

    public static LearningInsights empty() {
        return new LearningInsights(List.of(), List.of());
    }

    public boolean isEmpty() {
        return learnedPatterns.isEmpty() && deviceRelationships.isEmpty();
    }
}
