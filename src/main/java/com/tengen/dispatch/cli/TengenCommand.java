package com.tengen.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tengen.
 * Routes to subcommands: load, save, new, gtp, health.
 */
@Command(
        name = "tengen",
        mixinStandardHelpOptions = true,
        version = "Tengen 0.1.0",
        description = "Go game front end for GTP engines such as Fuego",
        subcommands = {
                LoadCommand.class,
                SaveCommand.class,
                NewCommand.class,
                SubmitCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TengenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
