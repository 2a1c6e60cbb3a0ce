package com.oncall.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oncall.core.model.ToolCallRequest;
import com.oncall.core.model.ToolErrorType;
import com.oncall.core.tools.ToolExecutionException;
import com.oncall.core.tools.ToolExecutor;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs device tool calls on the MCP server.
 * <p>
 * The target device is passed as an extra argument. A text result that is a JSON object
 * becomes the payload; anything else is wrapped under {@code raw_content}.
 */
@Component
public class McpToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(McpToolExecutor.class);

    static final String CONSUMER = "executor";
    static final String RAW_CONTENT = "raw_content";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final McpClientManager clientManager;
    private final McpProperties props;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public McpToolExecutor(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Map<String, Object> execute(ToolCallRequest request, String targetDevice)
            throws ToolExecutionException {
        McpSyncClient client = clientManager.getClientFor(CONSUMER);
        if (client == null) {
            throw new ToolExecutionException(ToolErrorType.COMMUNICATION,
                    "No MCP server configured or reachable");
        }

        Map<String, Object> arguments = new LinkedHashMap<>(request.parameters());
        arguments.put(props.getDeviceArgument(), targetDevice);

        McpSchema.CallToolResult result;
        try {
            log.debug("Calling {} on {}", request.functionName(), targetDevice);
            result = client.callTool(new McpSchema.CallToolRequest(request.functionName(), arguments));
        } catch (RuntimeException e) {
            ToolErrorType type = classify(e);
            log.warn("{} on {} failed ({}): {}", request.functionName(), targetDevice, type, e.getMessage());
            throw new ToolExecutionException(type, describe(e), e);
        }

        String text = textOf(result.content());
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ToolExecutionException(ToolErrorType.FUNCTION_VALIDATION,
                    text.isBlank() ? "Tool reported an error" : text);
        }
        return toPayload(text);
    }

    /**
     * Maps a client failure onto the tool error taxonomy. Authentication markers win over
     * the exception type since servers report 401/403 through transport and protocol errors alike.
     */
    static ToolErrorType classify(Throwable error) {
        boolean protocol = false;
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage() != null ? t.getMessage().toLowerCase(Locale.ROOT) : "";
            if (message.contains("401") || message.contains("403")
                    || message.contains("unauthorized") || message.contains("forbidden")) {
                return ToolErrorType.AUTHENTICATION;
            }
            if (t instanceof IOException || t instanceof TimeoutException) {
                return ToolErrorType.COMMUNICATION;
            }
            if (t instanceof McpError) {
                protocol = true;
            }
            if (t.getCause() == t) break;
        }
        return protocol ? ToolErrorType.PROTOCOL : ToolErrorType.COMMUNICATION;
    }

    Map<String, Object> toPayload(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readValue(trimmed, MAP_TYPE);
            } catch (JsonProcessingException e) {
                log.debug("Tool result is not a JSON object: {}", e.getOriginalMessage());
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RAW_CONTENT, text);
        return payload;
    }

    private static String textOf(List<McpSchema.Content> content) {
        if (content == null) return "";
        StringBuilder sb = new StringBuilder();
        for (McpSchema.Content item : content) {
            if (item instanceof McpSchema.TextContent textContent) {
                if (!sb.isEmpty()) sb.append('\n');
                sb.append(textContent.text());
            }
        }
        return sb.toString();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
