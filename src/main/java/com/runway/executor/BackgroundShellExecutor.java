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
import java.util.concurrent.Executor;

/**
 * Runs a shell command as a hidden child process and captures its output.
 *
 * <p>Resolves once the process has exited and both output streams are drained. A
 * process that cannot be spawned yields exit code 1 with the error as stderr.
 */
public class BackgroundShellExecutor extends AbstractCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundShellExecutor.class);

    private final ProcessLauncher launcher;
    private final TempResourceManager resources;
    private final Executor ioExecutor;

    public BackgroundShellExecutor(ProcessLauncher launcher, TempResourceManager resources,
                                   ExecutionProperties properties, RunwayMetrics metrics, Executor ioExecutor) {
        super(properties, metrics);
        this.launcher = launcher;
        this.resources = resources;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.BACKGROUND_SHELL;
    }

    @Override
    protected CompletableFuture<CommandResult> doExecute(String sessionId, Interaction interaction,
                                                         Session session, long startNanos) {
        var command = interaction.command();
        var spec = new ProcessSpec(
                List.of(properties.getShell(), "-c", command.text()),
                resources.buildEnvironment(sessionId, command, null),
                resolveWorkingDirectory(command),
                false);

        Process process;
        try {
            process = launcher.start(spec);
        } catch (IOException e) {
            log.warn("Failed to spawn background command for interaction {}: {}", interaction.id(), e.getMessage());
            return CompletableFuture.completedFuture(CommandResult.failure(describe(e), elapsedMs(startNanos)));
        }
        closeQuietly(process);
        log.info("Background command started for interaction {} (pid {})", interaction.id(), process.pid());

        var stdout = OutputCollector.collect(process.getInputStream(), ioExecutor);
        var stderr = OutputCollector.collect(process.getErrorStream(), ioExecutor);

        return CompletableFuture.allOf(process.onExit(), stdout, stderr)
                .thenApply(ignored -> new CommandResult(
                        stdout.join(), stderr.join(), process.exitValue(), elapsedMs(startNanos)));
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }
}
