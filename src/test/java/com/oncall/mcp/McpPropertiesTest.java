package com.oncall.mcp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpPropertiesTest {

    @Test
    @DisplayName("not configured unless enabled with a server URL")
    void isConfigured() {
        var props = new McpProperties();
        var server = new McpProperties.ServerConfig();
        props.setServers(Map.of("netops", server));

        assertFalse(props.isConfigured());
        props.setEnabled(true);
        assertFalse(props.isConfigured());
        server.setUrl("http://localhost:8000/mcp");
        assertTrue(props.isConfigured());
    }

    @Test
    @DisplayName("consumer token overrides the shared token")
    void tokenFor() {
        var server = new McpProperties.ServerConfig();
        server.setToken("shared");
        server.setTokens(Map.of("executor", "exec-token", "health", " "));

        assertEquals("exec-token", server.getTokenFor("EXECUTOR"));
        assertEquals("shared", server.getTokenFor("health"));
        assertEquals("shared", server.getTokenFor("cli"));
    }
}
