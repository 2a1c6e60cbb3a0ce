package com.oncall.dispatch.cli;

import com.oncall.core.learning.LearningService;
import com.oncall.core.model.SessionLearning;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: oncall learnings
 * <p>
 * Shows the session learnings that feed historical context into new sessions.
 */
@Command(name = "learnings", mixinStandardHelpOptions = true, description = "Show recent session learnings")
@Component
public class LearningsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final LearningService learningService;

    public LearningsCommand(LearningService learningService) {
        this.learningService = learningService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SessionLearning> sessions = learningService.recentSessions();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No previous sessions recorded.");
            return;
        }

        List<SessionLearning> display = sessions.size() > limit
                ? sessions.subList(sessions.size() - limit, sessions.size())
                : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-22s %s%n", "SESSION ID", "TIMESTAMP", "QUERY");
        System.out.println("  " + "-".repeat(76));
        for (SessionLearning session : display) {
            String timestamp = String.valueOf(session.timestamp());
            if (timestamp.length() > 19) timestamp = timestamp.substring(0, 19);
            System.out.printf("  %-14s %-22s %s%n", session.sessionId(), timestamp,
                    ConsoleOutput.truncate(session.userQuery(), 38));
            for (String pattern : session.learnedPatterns()) {
                System.out.println("      - " + pattern);
            }
        }
    }
}
