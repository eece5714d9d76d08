package com.runway.executor;

import com.runway.core.events.RemoteEvent;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.remote.RemoteStore;
import com.runway.core.resources.TempResourceManager;
import com.runway.executor.agent.AgentStreamClient;
import com.runway.executor.agent.AgentStreamEvent;
import com.runway.executor.agent.AgentStreamRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the agent as an embedded streaming call with tool use auto-approved.
 *
 * <p>Assistant text is appended to stdout. The terminal result decides the exit
 * code: 0 unless it carries the error flag. A stream that ends without a terminal
 * result counts as failed. Every event is also forwarded to the remote store;
 * forwarding failures are logged and never abort the stream.
 */
public class BackgroundAgentExecutor extends AbstractCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundAgentExecutor.class);

    static final String NO_RESULT_MESSAGE = "Agent stream ended without a result";

    private final AgentStreamClient streamClient;
    private final RemoteStore remoteStore;
    private final TempResourceManager resources;

    public BackgroundAgentExecutor(AgentStreamClient streamClient, RemoteStore remoteStore,
                                   TempResourceManager resources, ExecutionProperties properties,
                                   RunwayMetrics metrics) {
        super(properties, metrics);
        this.streamClient = streamClient;
        this.remoteStore = remoteStore;
        this.resources = resources;
    }

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.BACKGROUND_AGENT;
    }

    @Override
    protected CompletableFuture<CommandResult> doExecute(String sessionId, Interaction interaction,
                                                         Session session, long startNanos) {
        var command = interaction.command();
        var request = new AgentStreamRequest(
                promptOf(command),
                resolveWorkingDirectory(command),
                resources.buildEnvironment(sessionId, command, null),
                session == null ? null : session.conversationHandle());

        var stdout = new StringBuffer();
        var terminal = new AtomicReference<AgentStreamEvent.TerminalResult>();

        log.info("Starting background agent for interaction {}", interaction.id());
        return streamClient.stream(request, event -> {
                    if (event instanceof AgentStreamEvent.AssistantText text) {
                        stdout.append(text.text());
                    } else if (event instanceof AgentStreamEvent.TerminalResult result) {
                        terminal.set(result);
                    }
                    forward(sessionId, interaction.id(), event);
                })
                .thenApply(ignored -> toResult(stdout.toString(), terminal.get(), elapsedMs(startNanos)));
    }

    static CommandResult toResult(String stdout, AgentStreamEvent.TerminalResult terminal, long durationMs) {
        if (terminal == null) {
            return new CommandResult(stdout, NO_RESULT_MESSAGE, 1, durationMs);
        }
        if (terminal.isError()) {
            String reason = terminal.result() != null && !terminal.result().isBlank()
                    ? terminal.result()
                    : String.valueOf(terminal.subtype());
            return new CommandResult(stdout, reason, 1, durationMs);
        }
        return new CommandResult(stdout, "", 0, durationMs);
    }

    static String promptOf(Command command) {
        String prompt = command.prompt();
        return prompt != null && !prompt.isBlank() ? prompt : command.arguments();
    }

    private void forward(String sessionId, String interactionId, AgentStreamEvent event) {
        try {
            remoteStore.postEvent(new RemoteEvent(sessionId, interactionId, event.eventType(),
                    event.raw(), Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Failed to forward {} event for interaction {}: {}",
                    event.eventType(), interactionId, e.getMessage());
            if (metrics != null) metrics.recordRemoteFailure("post_event");
        }
    }
}
