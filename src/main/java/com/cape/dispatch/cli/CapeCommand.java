package com.cape.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the capability engine.
 * Routes to subcommands: list, match, run, sessions, health.
 */
@Command(
        name = "cape",
        mixinStandardHelpOptions = true,
        version = "Cape 0.1.0",
        description = "Capability execution engine",
        subcommands = {
                ListCommand.class,
                MatchCommand.class,
                RunCommand.class,
                SessionsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CapeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Reuse the CommandLine built by the Spring-aware factory
        spec.commandLine().usage(System.out);
    }
}
