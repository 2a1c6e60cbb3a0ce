package com.oncall.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oncall.core.tools.ToolCatalog;
import com.oncall.core.tools.ToolDescriptor;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes the device tools discovered on the MCP server.
 * <p>
 * The tool list is cached for {@code investigator.mcp.catalog-ttl}; a failed discovery
 * keeps the last known list.
 */
@Component
public class McpToolCatalog implements ToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(McpToolCatalog.class);

    private final McpClientManager clientManager;
    private final McpProperties props;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    private volatile List<ToolDescriptor> cached = List.of();
    private volatile Instant fetchedAt = Instant.EPOCH;

    public McpToolCatalog(McpClientManager clientManager, McpProperties props) {
        this(clientManager, props, Clock.systemUTC());
    }

    McpToolCatalog(McpClientManager clientManager, McpProperties props, Clock clock) {
        this.clientManager = clientManager;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public List<ToolDescriptor> availableTools() {
        Instant now = clock.instant();
        if (!cached.isEmpty() && fetchedAt.plus(props.getCatalogTtl()).isAfter(now)) {
            return cached;
        }
        synchronized (this) {
            McpSyncClient client = clientManager.getClientFor(McpToolExecutor.CONSUMER);
            if (client == null) {
                return cached;
            }
            try {
                List<ToolDescriptor> tools = new ArrayList<>();
                for (McpSchema.Tool tool : client.listTools().tools()) {
                    tools.add(new ToolDescriptor(tool.name(),
                            tool.description() != null ? tool.description() : "",
                            schemaText(tool.inputSchema())));
                }
                log.debug("MCP tool discovery returned {} tool(s)", tools.size());
                cached = List.copyOf(tools);
                fetchedAt = now;
            } catch (Exception e) {
                log.warn("Failed to discover MCP tools: {}", e.getMessage());
            }
            return cached;
        }
    }

    private String schemaText(Object schema) {
        if (schema == null) return "";
        try {
            return objectMapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize tool schema: {}", e.getMessage());
            return "";
        }
    }
}
