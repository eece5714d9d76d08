package com.runway.executor.agent;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Embedded streaming call into the external agent with tool use auto-approved.
 */
public interface AgentStreamClient {

    /**
     * Starts the run and hands each decoded event to {@code onEvent}, in order, on a
     * worker thread.
     *
     * @return completes when the stream has ended; completes exceptionally with
     *         {@link AgentStreamException} when the run could not start or failed
     *         without reporting a result
     */
    CompletableFuture<Void> stream(AgentStreamRequest request, Consumer<AgentStreamEvent> onEvent);
}
