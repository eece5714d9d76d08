package com.runway.executor;

import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.resources.TempResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a shell command in the user's terminal. Output goes to the terminal, so
 * the result carries only the exit code and duration.
 */
public class InteractiveShellExecutor extends AbstractCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(InteractiveShellExecutor.class);

    private final ProcessLauncher launcher;
    private final TempResourceManager resources;

    public InteractiveShellExecutor(ProcessLauncher launcher, TempResourceManager resources,
                                    ExecutionProperties properties, RunwayMetrics metrics) {
        super(properties, metrics);
        this.launcher = launcher;
        this.resources = resources;
    }

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.INTERACTIVE_SHELL;
    }

    @Override
    protected CompletableFuture<CommandResult> doExecute(String sessionId, Interaction interaction,
                                                         Session session, long startNanos) {
        var command = interaction.command();
        var spec = new ProcessSpec(
                List.of(properties.getShell(), "-c", command.text()),
                resources.buildEnvironment(sessionId, command, null),
                resolveWorkingDirectory(command),
                true);

        Process process;
        try {
            process = launcher.start(spec);
        } catch (IOException e) {
            log.warn("Failed to start terminal command for interaction {}: {}", interaction.id(), e.getMessage());
            return CompletableFuture.completedFuture(CommandResult.failure(describe(e), elapsedMs(startNanos)));
        }

        return process.onExit()
                .thenApply(p -> new CommandResult("", "", p.exitValue(), elapsedMs(startNanos)));
    }
}
