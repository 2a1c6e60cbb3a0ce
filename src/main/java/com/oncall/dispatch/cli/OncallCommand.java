package com.oncall.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: investigate, plans, learnings, serve.
 */
@Command(
        name = "oncall",
        mixinStandardHelpOptions = true,
        version = "oncall-investigator 0.1.0",
        description = "Investigates network devices with LLM-guided plans and MCP device tools",
        subcommands = {
                InvestigateCommand.class,
                PlansCommand.class,
                LearningsCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OncallCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
