package com.garrison.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Garrison.
 * Routes to subcommands: waves, simulate.
 */
@Command(
        name = "garrison",
        mixinStandardHelpOptions = true,
        version = "Garrison 0.1.0",
        description = "Escalating reinforcement coordination for contested strongpoints",
        subcommands = {
                WavesCommand.class,
                SimulateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GarrisonCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
