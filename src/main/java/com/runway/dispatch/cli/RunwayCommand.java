package com.runway.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Runway.
 * Routes to subcommands: serve, attach.
 */
@Command(
        name = "runway",
        mixinStandardHelpOptions = true,
        version = "Runway 0.1.0",
        description = "Runs session commands issued by a remote command queue",
        subcommands = {
                ServeCommand.class,
                AttachCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RunwayCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
