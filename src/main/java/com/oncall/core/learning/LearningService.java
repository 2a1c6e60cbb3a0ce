package com.oncall.core.learning;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.model.LearningInsights;
import com.oncall.core.model.SessionLearning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads historical context for new sessions and records finished ones.
 * Both directions are best effort: a failing store never fails a session.
 */
@Service
public class LearningService {

    private static final Logger log = LoggerFactory.getLogger(LearningService.class);
    private static final int REPORT_PREVIEW_CHARS = 300;
    private static final int MAX_CARRIED_ITEMS = 10;

    private final LearningStore store;
    private final LearningInsightsExtractor extractor;
    private final InvestigatorProperties properties;

    public LearningService(LearningStore store, LearningInsightsExtractor extractor,
                           InvestigatorProperties properties) {
        this.store = store;
        this.extractor = extractor;
        this.properties = properties;
    }

    /**
     * Markdown summary of recent sessions, or an empty string when there are none.
     */
    public String historicalContext() {
        if (!properties.getLearning().isEnabled()) {
            return "";
        }
        List<SessionLearning> sessions;
        try {
            sessions = store.recent(properties.getLearning().getMaxSessions());
        } catch (RuntimeException e) {
            log.warn("Cannot load historical context: {}", e.getMessage());
            return "";
        }
        return render(sessions);
    }

    static String render(List<SessionLearning> sessions) {
        if (sessions.isEmpty()) {
            return "";
        }
        SessionLearning latest = sessions.get(sessions.size() - 1);
        var sb = new StringBuilder();
        sb.append("Previous sessions: ").append(sessions.size()).append("\n");
        sb.append("Latest session ").append(latest.sessionId()).append(" asked: ").append(latest.userQuery()).append("\n");
        if (latest.report() != null && !latest.report().isBlank()) {
            String report = latest.report();
            sb.append("Latest report preview: ")
              .append(report.length() > REPORT_PREVIEW_CHARS ? report.substring(0, REPORT_PREVIEW_CHARS) + "..." : report)
              .append("\n");
        }

        Set<String> patterns = new LinkedHashSet<>();
        Set<String> relationships = new LinkedHashSet<>();
        for (int i = sessions.size() - 1; i >= 0; i--) {
            patterns.addAll(sessions.get(i).learnedPatterns());
            relationships.addAll(sessions.get(i).deviceRelationships());
        }
        appendList(sb, "Learned patterns", patterns);
        appendList(sb, "Device relationships", relationships);
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String title, Set<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(title).append(":\n");
        items.stream().limit(MAX_CARRIED_ITEMS).forEach(item -> sb.append("- ").append(item).append("\n"));
    }

    /**
     * Extracts insights from the report and stores the session.
     *
     * @return the insights recorded, empty if learning is disabled or failed
     */
    public LearningInsights record(String sessionId, String userQuery, String report) {
        if (!properties.getLearning().isEnabled()) {
            return LearningInsights.empty();
        }
        LearningInsights insights = extractor.extract(userQuery, report);
        try {
            store.append(new SessionLearning(sessionId, Instant.now(), userQuery, report,
                    insights.learnedPatterns(), insights.deviceRelationships()));
        } catch (RuntimeException e) {
            log.warn("Cannot store learnings for session {}: {}", sessionId, e.getMessage());
        }
        return insights;
    }

    public List<SessionLearning> recentSessions() {
        return store.recent(properties.getLearning().getMaxSessions());
    }
}
