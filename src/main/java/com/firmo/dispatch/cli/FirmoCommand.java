package com.firmo.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Firmo.
 * Routes to subcommands: run, list.
 */
@Command(
        name = "firmo",
        mixinStandardHelpOptions = true,
        version = "Firmo 0.4.0",
        description = "Runs Firmo test specs and reports their outcomes",
        subcommands = {
                RunCommand.class,
                ListCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FirmoCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
