package com.oncall.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Connection settings for the MCP servers that expose device tools.
 *
 * <pre>
 * investigator:
 *   mcp:
 *     enabled: true
 *     device-argument: device_name
 *     servers:
 *       netops:
 *         url: http://localhost:8000/mcp
 *         token: shared-token
 *         tokens:
 *           executor: scoped-token-for-tool-calls
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "investigator.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration catalogTtl = Duration.ofMinutes(5);
    /** Argument name under which the target device is passed to every tool. */
    private String deviceArgument = "device_name";
    private Map<String, ServerConfig> servers = new HashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getCatalogTtl() { return catalogTtl; }
    public void setCatalogTtl(Duration catalogTtl) { this.catalogTtl = catalogTtl; }
    public String getDeviceArgument() { return deviceArgument; }
    public void setDeviceArgument(String deviceArgument) { this.deviceArgument = deviceArgument; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream()
                .anyMatch(s -> s.getUrl() != null && !s.getUrl().isBlank());
    }

    public static class ServerConfig {
        private String url = "";
        private String token = "";
        private Map<String, String> tokens = new HashMap<>();

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public Map<String, String> getTokens() { return tokens; }
        public void setTokens(Map<String, String> tokens) { this.tokens = tokens; }

        /**
         * Per-consumer token override, falling back to the shared token.
         */
        public String getTokenFor(String consumer) {
            String specific = tokens.get(consumer.toLowerCase(Locale.ROOT));
            if (specific != null && !specific.isBlank()) return specific;
            return token;
        }
    }
}
