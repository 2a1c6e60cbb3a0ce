package com.oncall.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class McpHealthIndicatorTest {

    private McpClientManager clientManager;
    private McpHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        clientManager = mock(McpClientManager.class);
        var props = new McpProperties();
        var server = new McpProperties.ServerConfig();
        server.setUrl("http://localhost:8000/mcp");
        props.setServers(Map.of("netops", server));
        indicator = new McpHealthIndicator(clientManager, props);
        when(clientManager.isConfigured()).thenReturn(true);
    }

    private static McpSyncClient clientWithTools(int count) {
        McpSyncClient client = mock(McpSyncClient.class);
        McpSchema.ListToolsResult result = mock(McpSchema.ListToolsResult.class);
        List<McpSchema.Tool> tools = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tools.add(mock(McpSchema.Tool.class));
        }
        when(result.tools()).thenReturn(tools);
        when(client.listTools()).thenReturn(result);
        return client;
    }

    private static McpSyncClient unreachableClient() {
        McpSyncClient client = mock(McpSyncClient.class);
        when(client.listTools()).thenThrow(new RuntimeException("connection refused"));
        return client;
    }

    private void connections(Map<String, McpSyncClient> clients) {
        when(clientManager.getClients()).thenReturn(clients);
    }

    @Test
    @DisplayName("unknown when no server is configured")
    void notConfigured() {
        when(clientManager.isConfigured()).thenReturn(false);

        assertEquals(Status.UNKNOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("up and idle before any connection is opened")
    void idle() {
        connections(Map.of());

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(Map.of("url", "http://localhost:8000/mcp", "state", "idle"),
                health.getDetails().get("netops"));
    }

    @Test
    @DisplayName("reports the tool count of every open connection")
    void toolCounts() {
        var clients = new LinkedHashMap<String, McpSyncClient>();
        clients.put("netops:1", clientWithTools(4));
        connections(clients);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(Map.of("state", "connected", "tools", 4), health.getDetails().get("netops:1"));
    }

    @Test
    @DisplayName("degraded when only some connections answer")
    void degraded() {
        var clients = new LinkedHashMap<String, McpSyncClient>();
        clients.put("netops:1", clientWithTools(2));
        clients.put("netops:2", unreachableClient());
        connections(clients);

        Health health = indicator.health();

        assertEquals(McpHealthIndicator.DEGRADED, health.getStatus().getCode());
        assertEquals(Map.of("state", "unreachable", "error", "connection refused"),
                health.getDetails().get("netops:2"));
    }

    @Test
    @DisplayName("down when no connection answers")
    void down() {
        connections(Map.of("netops:1", unreachableClient()));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
