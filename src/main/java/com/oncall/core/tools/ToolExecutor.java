package com.oncall.core.tools;

import com.oncall.core.model.ToolCallRequest;

import java.util.Map;

/**
 * Performs data-gathering calls against network devices.
 */
public interface ToolExecutor {

    /**
     * Executes one call against the given device.
     *
     * @param request function name and arguments
     * @param targetDevice device the call is aimed at
     * @return the structured payload returned by the tool
     * @throws ToolExecutionException on a communication, authentication, protocol or validation failure
     */
    Map<String, Object> execute(ToolCallRequest request, String targetDevice) throws ToolExecutionException;
}
