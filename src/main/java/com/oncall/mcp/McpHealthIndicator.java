package com.oncall.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator health of the device tool servers.
 * <p>
 * Every open connection is asked for its tool list, and the details report how many
 * tools each one offers. DOWN when no connection answers, DEGRADED when only some do.
 * Servers without a connection yet are listed but not contacted.
 */
@Component
@ConditionalOnProperty(prefix = "investigator.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpHealthIndicator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "no MCP server URL configured").build();
        }

        Map<String, McpSyncClient> clients = clientManager.getClients();
        var details = new LinkedHashMap<String, Object>();
        props.getServers().forEach((name, config) -> {
            if (config.getUrl() != null && !config.getUrl().isBlank()) {
                details.put(name, Map.of("url", config.getUrl(), "state", "idle"));
            }
        });

        int answered = 0;
        for (var entry : clients.entrySet()) {
            Map<String, Object> connection = describe(entry.getValue());
            if (connection.containsKey("tools")) {
                answered++;
            }
            details.put(entry.getKey(), connection);
        }

        Health.Builder builder;
        if (clients.isEmpty() || answered == clients.size()) {
            builder = Health.up();
        } else if (answered == 0) {
            builder = Health.down();
        } else {
            builder = Health.status(DEGRADED);
        }
        return builder.withDetails(details).build();
    }

    private static Map<String, Object> describe(McpSyncClient client) {
        try {
            int tools = client.listTools().tools().size();
            return Map.of("state", "connected", "tools", tools);
        } catch (Exception e) {
            return Map.of("state", "unreachable", "error", String.valueOf(e.getMessage()));
        }
    }
}
