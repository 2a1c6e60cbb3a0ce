package com.oncall.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from {@code investigator.*}.
 *
 * <pre>
 * investigator:
 *   max-retries: 3
 *   max-concurrency: 4
 *   session-timeout: 5m
 *   plans:
 *     location: classpath:plans/
 *   learning:
 *     store-path: ./data/learnings.json
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "investigator")
public class InvestigatorProperties {

    private int maxRetries = 3;
    private int maxConcurrency = 4;
    private Duration sessionTimeout = Duration.ofMinutes(5);
    private Duration cancellationGrace = Duration.ofSeconds(10);
    private Plans plans = new Plans();
    private Inventory inventory = new Inventory();
    private Learning learning = new Learning();
    private Graph graph = new Graph();

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    public Duration getSessionTimeout() { return sessionTimeout; }
    public void setSessionTimeout(Duration sessionTimeout) { this.sessionTimeout = sessionTimeout; }
    public Duration getCancellationGrace() { return cancellationGrace; }
    public void setCancellationGrace(Duration cancellationGrace) { this.cancellationGrace = cancellationGrace; }
    public Plans getPlans() { return plans; }
    public void setPlans(Plans plans) { this.plans = plans; }
    public Inventory getInventory() { return inventory; }
    public void setInventory(Inventory inventory) { this.inventory = inventory; }
    public Learning getLearning() { return learning; }
    public void setLearning(Learning learning) { this.learning = learning; }
    public Graph getGraph() { return graph; }
    public void setGraph(Graph graph) { this.graph = graph; }

    public static class Plans {
        /** {@code classpath:} prefix or a filesystem directory holding {@code <intent>.json} files. */
        private String location = "classpath:plans/";
        /** Intent used when plan selection fails; blank means selection failures are fatal. */
        private String defaultIntent = "";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public String getDefaultIntent() { return defaultIntent; }
        public void setDefaultIntent(String defaultIntent) { this.defaultIntent = defaultIntent; }
    }

    public static class Inventory {
        /** Known device names; when non-empty, resolved targets outside this list are dropped. */
        private List<String> devices = new ArrayList<>();

        public List<String> getDevices() { return devices; }
        public void setDevices(List<String> devices) { this.devices = devices; }
    }

    public static class Learning {
        private boolean enabled = true;
        private String storePath = "./data/learnings.json";
        private int maxSessions = 20;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getStorePath() { return storePath; }
        public void setStorePath(String storePath) { this.storePath = storePath; }
        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }
    }

    public static class Graph {
        private int recursionLimit = 100;

        public int getRecursionLimit() { return recursionLimit; }
        public void setRecursionLimit(int recursionLimit) { this.recursionLimit = recursionLimit; }
    }
}
