package com.codearena.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the executor.
 * Routes to subcommands: run, health.
 */
@Command(
        name = "codearena",
        mixinStandardHelpOptions = true,
        version = "CodeArena Executor 0.1.0",
        description = "Runs learner submissions against their test cases in sandboxes",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodeArenaCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
