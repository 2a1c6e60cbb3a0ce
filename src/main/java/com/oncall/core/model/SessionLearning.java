package com.oncall.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * What a finished session leaves behind for later sessions.
 */
public record SessionLearning(
    String sessionId,
    Instant timestamp,
    String userQuery,
    String report,
    List<String> learnedPatterns,
    List<String> deviceRelationships
) implements Serializable {

    public SessionLearning {
        learnedPatterns = learnedPatterns != null ? List.copyOf(learnedPatterns) : List.of();
        deviceRelationships = deviceRelationships != null ? List.copyOf(deviceRelationships) : List.of();
    }
}
