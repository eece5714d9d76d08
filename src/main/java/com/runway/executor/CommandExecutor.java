package com.runway.executor;

import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;

import java.util.concurrent.CompletableFuture;

/**
 * One execution strategy for interaction commands.
 *
 * <p>The returned future never completes exceptionally: spawn failures, stream
 * errors and the like are reported as a result with exit code 1 and the message in
 * stderr. Only {@link CommandValidationException} and
 * {@link com.runway.bridge.CallbackBridgeException} are thrown, synchronously.
 */
public interface CommandExecutor {

    ExecutorKind kind();

    /**
     * Runs the interaction's command. An empty or whitespace-only command completes
     * immediately with {@link CommandResult#empty()}.
     */
    CompletableFuture<CommandResult> execute(String sessionId, Interaction interaction, Session session);
}
