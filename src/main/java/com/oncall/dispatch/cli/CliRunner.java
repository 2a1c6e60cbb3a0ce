package com.oncall.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and keeps its exit code
 * for {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * {@code serve} is left alone: the web server started by the context is the whole job.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_UNEXPECTED = 1;

    private final OncallCommand oncallCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(OncallCommand oncallCommand, IFactory factory) {
        this.oncallCommand = oncallCommand;
        this.factory = factory;
    }

    /**
     * True when the first argument that is not an option names the {@code serve} command.
     * A query that merely contains the word does not count.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            log.debug("Serve mode, CLI dispatch skipped");
            return;
        }
        exitCode = commandLine().execute(args);
        log.debug("CLI finished with exit code {}", exitCode);
    }

    CommandLine commandLine() {
        return new CommandLine(oncallCommand, factory)
                .setUsageHelpAutoWidth(true)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.error("Command '{}' failed", cmd.getCommandName(), e);
                    ConsoleOutput.error("Unexpected error: " + e.getMessage());
                    return EXIT_UNEXPECTED;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
