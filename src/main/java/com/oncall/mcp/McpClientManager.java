package com.oncall.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the MCP sync clients used for device tools.
 * <p>
 * Clients are created lazily per consumer and cached by server and token, so consumers
 * sharing a token share a connection. Only the first configured server is used.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;

    /** "server:token-hash" to client. */
    private final Map<String, McpSyncClient> clientCache = new ConcurrentHashMap<>();

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    @PostConstruct
    void init() {
        if (!props.isConfigured()) {
            log.info("MCP servers disabled or not configured; device tools are unavailable");
            return;
        }
        props.getServers().forEach((name, config) -> {
            if (config.getUrl() != null && !config.getUrl().isBlank()) {
                log.info("MCP server '{}' configured at {}", name, config.getUrl());
            }
        });
    }

    /**
     * Returns a connected client for the consumer, or null if no server is configured or reachable.
     */
    public McpSyncClient getClientFor(String consumer) {
        if (!props.isConfigured()) return null;

        for (var entry : props.getServers().entrySet()) {
            String serverName = entry.getKey();
            var config = entry.getValue();
            if (config.getUrl() == null || config.getUrl().isBlank()) continue;

            String token = config.getTokenFor(consumer);
            String cacheKey = serverName + ":" + (token != null ? token.hashCode() : "none");

            return clientCache.computeIfAbsent(cacheKey, key -> {
                try {
                    var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
                    if (token != null && !token.isBlank()) {
                        transportBuilder.customizeRequest(req ->
                                req.header("Authorization", "Bearer " + token));
                    }
                    var client = McpClient.sync(transportBuilder.build())
                            .requestTimeout(props.getRequestTimeout())
                            .build();
                    client.initialize();
                    log.info("MCP client created for consumer '{}' on server '{}'", consumer, serverName);
                    return client;
                } catch (Exception e) {
                    log.warn("Failed to create MCP client for consumer '{}' on server '{}': {}",
                            consumer, serverName, e.getMessage());
                    return null;
                }
            });
        }
        return null;
    }

    public Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(clientCache);
    }

    public boolean hasClients() {
        return !clientCache.isEmpty();
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    void shutdown() {
        clientCache.forEach((key, client) -> {
            try {
                client.close();
                log.info("MCP client '{}' disconnected", key);
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", key, e.getMessage());
            }
        });
        clientCache.clear();
    }
}
