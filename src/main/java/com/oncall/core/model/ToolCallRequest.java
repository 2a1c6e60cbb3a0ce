package com.oncall.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single data-gathering call proposed by the reasoning oracle.
 */
public record ToolCallRequest(
    String functionName,
    Map<String, Object> parameters
) implements Serializable {

    public ToolCallRequest {
        // model output may carry null argument values, so Map.copyOf is not an option
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }
}
