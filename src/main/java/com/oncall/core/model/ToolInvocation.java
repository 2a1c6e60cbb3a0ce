package com.oncall.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One executed (or not yet executed) call against a device.
 * <p>
 * Once executed exactly one of {@code result} and {@code error} is set.
 *
 * @param functionName tool name
 * @param parameters arguments passed to the tool
 * @param result structured payload returned by the tool, or null
 * @param error failure reported by the tool executor, or null
 */
public record ToolInvocation(
    String functionName,
    Map<String, Object> parameters,
    Map<String, Object> result,
    ToolError error
) implements Serializable {

    public static ToolInvocation succeeded(ToolCallRequest request, Map<String, Object> result) {
        return new ToolInvocation(request.functionName(), request.parameters(),
                result != null ? result : Map.of(), null);
    }

    public static ToolInvocation failed(ToolCallRequest request, ToolError error) {
        return new ToolInvocation(request.functionName(), request.parameters(), null, error);
    }

    public boolean isExecuted() {
        return result != null || error != null;
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }
}
