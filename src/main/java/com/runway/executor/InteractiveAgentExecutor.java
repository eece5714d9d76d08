package com.runway.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runway.bridge.CallbackBridge;
import com.runway.bridge.CallbackBridgeRegistry;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.resources.TempResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the external agent CLI in the user's terminal and waits for two signals:
 * the process exiting and the agent's {@code Stop} hook reaching the session's
 * {@link CallbackBridge}.
 *
 * <p>Flow:
 * <ol>
 *   <li>Register a one-time bridge handler for the interaction</li>
 *   <li>Write a hook settings file pointing the {@code Stop} hook at the callback URL</li>
 *   <li>Launch the agent with the callback URL in its environment</li>
 *   <li>Join process exit and hook delivery via {@link CompletionJoin}</li>
 * </ol>
 *
 * <p>Either way the result is the process's own; the hook only synchronizes. When
 * the hook does not arrive in time the process result is used alone and a warning
 * is logged. The registration is left in place so a late delivery is still
 * forwarded to the remote store; the remote store reconciles it.
 */
public class InteractiveAgentExecutor extends AbstractCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(InteractiveAgentExecutor.class);

    private final ProcessLauncher launcher;
    private final TempResourceManager resources;
    private final CallbackBridgeRegistry bridges;
    private final ObjectMapper objectMapper;

    public InteractiveAgentExecutor(ProcessLauncher launcher, TempResourceManager resources,
                                    CallbackBridgeRegistry bridges, ObjectMapper objectMapper,
                                    ExecutionProperties properties, RunwayMetrics metrics) {
        super(properties, metrics);
        this.launcher = launcher;
        this.resources = resources;
        this.bridges = bridges;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.INTERACTIVE_AGENT;
    }

    @Override
    protected CompletableFuture<CommandResult> doExecute(String sessionId, Interaction interaction,
                                                         Session session, long startNanos) {
        var command = interaction.command();
        CallbackBridge bridge = bridges.getOrStart(sessionId);
        String callbackUrl = bridge.getCallbackUrl(interaction.id());

        var hookDelivered = new CompletableFuture<Object>();
        bridge.onCommandComplete(interaction.id(), hookDelivered::complete);

        Process process;
        try {
            Path settings = resources.createTempFile(sessionId, "hooks-", ".json", hookSettings());
            var spec = new ProcessSpec(
                    agentArguments(command, settings, session),
                    resources.buildEnvironment(sessionId, command, callbackUrl),
                    resolveWorkingDirectory(command),
                    true);
            process = launcher.start(spec);
        } catch (IOException | RuntimeException e) {
            bridge.cancel(interaction.id());
            log.warn("Failed to launch agent for interaction {}: {}", interaction.id(), e.getMessage());
            return CompletableFuture.completedFuture(CommandResult.failure(describe(e), elapsedMs(startNanos)));
        }
        log.info("Agent started in terminal for interaction {} (pid {}), callback {}",
                interaction.id(), process.pid(), callbackUrl);

        CompletableFuture<Integer> processExit = process.onExit().thenApply(Process::exitValue);

        return CompletionJoin.awaitBoth(processExit, hookDelivered, properties.getHookTimeout())
                .thenCompose(outcome -> {
                    if (outcome == JoinOutcome.TIMED_OUT) {
                        log.warn("No {} within {} for interaction {}; continuing with the process result only",
                                hookDelivered.isDone() ? "process exit" : "hook delivery",
                                properties.getHookTimeout(), interaction.id());
                        if (metrics != null) metrics.recordHookTimeout();
                        bridge.expire(interaction.id());
                    }
                    return processExit;
                })
                .thenApply(exitCode -> new CommandResult("", "", exitCode, elapsedMs(startNanos)));
    }

    List<String> agentArguments(Command command, Path settingsFile, Session session) {
        var args = new ArrayList<String>();
        args.add(properties.getAgentCommand());
        args.add("--settings");
        args.add(settingsFile.toString());
        if (session != null && session.conversationHandle() != null && !session.conversationHandle().isBlank()) {
            args.add("--resume");
            args.add(session.conversationHandle());
        }
        String prompt = command.prompt() != null && !command.prompt().isBlank()
                ? command.prompt()
                : command.arguments();
        if (!prompt.isBlank()) {
            args.add(prompt);
        }
        return args;
    }

    /**
     * Settings registering a {@code Stop} hook that POSTs the hook payload (stdin)
     * to the callback URL from the environment.
     */
    String hookSettings() {
        ObjectNode hook = objectMapper.createObjectNode();
        hook.put("type", "command");
        hook.put("command", "curl -s -X POST -H 'Content-Type: application/json' --data-binary @- \"$"
                + TempResourceManager.ENV_CALLBACK_URL + "\"");

        ObjectNode matcher = objectMapper.createObjectNode();
        matcher.putArray("hooks").add(hook);

        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("hooks").putArray("Stop").add(matcher);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render hook settings", e);
        }
    }
}
