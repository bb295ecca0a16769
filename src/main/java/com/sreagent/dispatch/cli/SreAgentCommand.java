package com.sreagent.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the SRE Agent orchestrator.
 */
@Command(
        name = "sre-agent",
        mixinStandardHelpOptions = true,
        version = "SRE Agent Orchestrator 0.1.0",
        description = "Routes operator requests to short-lived SRE workers",
        subcommands = {
                ServeCommand.class,
                QueryCommand.class,
                WorkersCommand.class,
                InspectCommand.class,
                StatsCommand.class,
                HistoryCommand.class,
                WatchCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SreAgentCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
