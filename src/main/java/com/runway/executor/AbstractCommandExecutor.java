package com.runway.executor;

import com.runway.bridge.CallbackBridgeException;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandKind;
import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Shared contract enforcement for the four strategies: the empty-command no-op, the
 * command-kind check, conversion of every other failure into a failed result, output
 * bounding and metrics.
 */
public abstract class AbstractCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(AbstractCommandExecutor.class);

    protected final ExecutionProperties properties;
    protected final RunwayMetrics metrics;

    protected AbstractCommandExecutor(ExecutionProperties properties, RunwayMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public final CompletableFuture<CommandResult> execute(String sessionId, Interaction interaction, Session session) {
        Command command = interaction.command();
        if (command.isBlank()) {
            log.debug("Interaction {} has an empty command, nothing to run", interaction.id());
            return CompletableFuture.completedFuture(CommandResult.empty());
        }

        CommandKind actual = CommandKind.of(command, properties.getAgentCommand());
        if (actual != kind().commandKind()) {
            throw new CommandValidationException("%s executor cannot run a %s command (interaction %s)"
                    .formatted(kind(), actual, interaction.id()));
        }

        long startNanos = System.nanoTime();
        CompletableFuture<CommandResult> future;
        try {
            future = doExecute(sessionId, interaction, session, startNanos);
        } catch (CommandValidationException | CallbackBridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed to start interaction {}", kind(), interaction.id(), e);
            future = CompletableFuture.completedFuture(
                    CommandResult.failure(describe(e), elapsedMs(startNanos)));
        }

        return future
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    log.error("{} failed while running interaction {}", kind(), interaction.id(), cause);
                    return CommandResult.failure(describe(cause), elapsedMs(startNanos));
                })
                .thenApply(result -> {
                    var bounded = bound(result);
                    if (metrics != null) {
                        metrics.recordCommandExecution(kind().name(), bounded.succeeded(), bounded.durationMs());
                    }
                    log.info("{} finished interaction {} with exit code {} in {}ms",
                            kind(), interaction.id(), bounded.exitCode(), bounded.durationMs());
                    return bounded;
                });
    }

    /**
     * Runs a validated, non-empty command. May throw a runtime exception or complete
     * exceptionally; both become a failed result.
     */
    protected abstract CompletableFuture<CommandResult> doExecute(String sessionId, Interaction interaction,
                                                                  Session session, long startNanos);

    /**
     * Metadata {@code cwd}, then the configured workspace root, then this process's
     * own working directory.
     */
    protected Path resolveWorkingDirectory(Command command) {
        String cwd = command.workingDirectory();
        if (cwd != null) {
            Path path = Path.of(cwd);
            if (Files.isDirectory(path)) {
                return path;
            }
            log.warn("Working directory {} does not exist, falling back", cwd);
        }
        Path root = properties.getWorkspaceRoot();
        if (root != null && Files.isDirectory(root)) {
            return root;
        }
        return Path.of(System.getProperty("user.dir"));
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    protected static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private CommandResult bound(CommandResult result) {
        int max = properties.getMaxOutputChars();
        return new CommandResult(
                OutputCollector.truncate(result.stdout(), max),
                OutputCollector.truncate(result.stderr(), max),
                result.exitCode(),
                result.durationMs());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
