package com.oncall.dispatch.cli;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.engine.InvestigationEngine;
import com.oncall.core.engine.InvestigationResult;
import com.oncall.core.engine.SessionOptions;
import com.oncall.core.error.InvestigationException;
import com.oncall.core.events.EventBus;
import com.oncall.core.model.ObjectiveStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: oncall investigate "&lt;query&gt;"
 * <p>
 * Runs one investigation session to completion and prints the report.
 * Exit code 0 when the objective was achieved, 2 when it was not, 1 on a fatal error.
 */
@Command(name = "investigate", mixinStandardHelpOptions = true,
        description = "Investigate devices named in a natural-language query")
@Component
public class InvestigateCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Natural language investigation query")
    private List<String> query;

    @Option(names = {"--max-retries", "-r"}, description = "Retry bound for this session")
    private Integer maxRetries;

    @Option(names = {"--timeout", "-t"}, description = "Session timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = {"--watch", "-w"}, description = "Print progress events while the session runs")
    private boolean watch;

    private final InvestigationEngine engine;
    private final EventBus eventBus;
    private final InvestigatorProperties properties;

    public InvestigateCommand(InvestigationEngine engine, EventBus eventBus, InvestigatorProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String userQuery = String.join(" ", query);
        SessionOptions options;
        try {
            options = SessionOptions.defaults(properties)
                    .withMaxRetries(maxRetries)
                    .withTimeout(timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Investigating: " + userQuery);
        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        InvestigationResult result;
        try {
            result = engine.submit(userQuery, options);
        } catch (InvestigationException e) {
            ConsoleOutput.error("Investigation failed: " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        System.out.println(result.summary());
        ConsoleOutput.result(result);
        return result.objectiveStatus() == ObjectiveStatus.ACHIEVED ? 0 : 2;
    }
}
