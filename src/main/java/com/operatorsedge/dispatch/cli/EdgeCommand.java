package com.operatorsedge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, status, junction, migrate, health.
 */
@Command(
        name = "edge",
        mixinStandardHelpOptions = true,
        version = "Operator's Edge 0.1.0",
        description = "Supervisor for autonomous agent turns: gears, junctions and the dispatch loop",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                JunctionCommand.class,
                MigrateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EdgeCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
