package com.runway.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up, with Spring as the
 * picocli factory so subcommands get the orchestrator injected.
 *
 * <p>{@code serve} is not dispatched: the embedded web server keeps the JVM alive
 * and notifications drive the sessions. For {@code attach} the subcommand's return
 * value becomes the process exit code through {@link ExitCodeGenerator}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String SERVE = "serve";

    private final RunwayCommand runwayCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(RunwayCommand runwayCommand, IFactory factory) {
        this.runwayCommand = runwayCommand;
        this.factory = factory;
    }

    /**
     * The first argument that is not an option, or null. Lets {@code attach serve}
     * name a session called "serve" without being taken for serve mode.
     */
    public static String subcommandOf(String... args) {
        for (String arg : args) {
            if (arg != null && !arg.startsWith("-")) {
                return arg;
            }
        }
        return null;
    }

    @Override
    public void run(String... args) {
        if (SERVE.equals(subcommandOf(args))) {
            return;
        }
        exitCode = new CommandLine(runwayCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
