package com.runway.core.engine;

import com.runway.bridge.CallbackBridgeException;
import com.runway.bridge.CallbackBridgeRegistry;
import com.runway.core.logging.MdcContext;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandKind;
import com.runway.core.model.CommandResult;
import com.runway.core.model.Interaction;
import com.runway.core.model.ResultSubmission;
import com.runway.core.model.Session;
import com.runway.core.model.SessionStatus;
import com.runway.core.remote.RemoteStore;
import com.runway.core.remote.RemoteStoreException;
import com.runway.core.resources.TempResourceManager;
import com.runway.executor.CommandExecutor;
import com.runway.executor.CommandValidationException;
import com.runway.executor.ExecutionProperties;
import com.runway.executor.ExecutorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Per-session state machine: {@code idle -> executing -> idle -> ... -> terminal}.
 *
 * <p>A step fetches the next command, runs it on the executor picked by
 * (execution mode, command kind), and submits the result. The session stays
 * {@code executing} until the remote store's completion notification for that
 * interaction arrives; only then may the next step start. Notifications may be
 * duplicated and are handled idempotently.
 *
 * <p>Commands carrying child session ids fan out: every child runs with auto-play
 * until it reaches a terminal status, and the parent interaction gets one
 * aggregated result.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final RemoteStore remoteStore;
    private final ExecutorRegistry executors;
    private final CallbackBridgeRegistry bridges;
    private final TempResourceManager resources;
    private final RunwayMetrics metrics;
    private final Executor workers;
    private final String agentCommand;
    private final SessionRegistry sessions = new SessionRegistry();

    @Autowired
    public SessionOrchestrator(RemoteStore remoteStore, ExecutorRegistry executors,
                               CallbackBridgeRegistry bridges, TempResourceManager resources,
                               ExecutionProperties properties, RunwayMetrics metrics,
                               @Qualifier("runwayExecutor") Executor workers) {
        this(remoteStore, executors, bridges, resources, metrics, workers, properties.getAgentCommand());
    }

    SessionOrchestrator(RemoteStore remoteStore, ExecutorRegistry executors,
                        CallbackBridgeRegistry bridges, TempResourceManager resources,
                        RunwayMetrics metrics, Executor workers, String agentCommand) {
        this.remoteStore = remoteStore;
        this.executors = executors;
        this.bridges = bridges;
        this.resources = resources;
        this.metrics = metrics;
        this.workers = workers;
        this.agentCommand = agentCommand;
    }

    public SessionRegistry sessions() {
        return sessions;
    }

    public Optional<SessionState> find(String sessionId) {
        return sessions.find(sessionId);
    }

    /**
     * Starts the next step of the session unless one is already in flight.
     *
     * @return true if a step was started, false if this call was a no-op
     */
    public boolean executeNext(String sessionId) {
        var state = sessions.getOrCreate(sessionId);
        if (!state.tryBeginExecution()) {
            log.debug("Session {} is busy or finished, executeNext ignored", sessionId);
            return false;
        }
        log.info("Session {}: requesting next command", sessionId);

        CompletableFuture.supplyAsync(() -> remoteStore.getNextCommand(sessionId), workers)
                .thenCompose(session -> runStep(state, session))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        if (cause instanceof RemoteStoreException) {
                            log.warn("Session {}: could not fetch next command: {}", sessionId, cause.getMessage());
                            if (metrics != null) metrics.recordRemoteFailure("next_command");
                        } else {
                            log.error("Session {}: step failed", sessionId, cause);
                        }
                        state.endExecution();
                    }
                });
        return true;
    }

    /**
     * Reaction to an {@code interaction_completed} notification. Clears the executing
     * flag when the interaction is the one in flight and, with auto-play on,
     * requests the next command. Duplicates are no-ops.
     *
     * @return true if the notification moved the session to idle
     */
    public boolean onInteractionCompleted(String sessionId, String interactionId) {
        var state = sessions.find(sessionId).orElse(null);
        if (state == null) {
            log.debug("Completion for unknown session {} ignored", sessionId);
            return false;
        }
        if (!state.completeExecution(interactionId)) {
            log.debug("Session {}: completion for {} is not the in-flight interaction, ignored",
                    sessionId, interactionId);
            return false;
        }
        log.info("Session {}: interaction {} completed", sessionId, interactionId);
        if (state.isAutoPlayEnabled()) {
            executeNext(sessionId);
        }
        return true;
    }

    /**
     * Reaction to a {@code session_updated} notification: refreshes the cached
     * snapshot and ends the session when its status is terminal. An idle
     * auto-playing session with a pending interaction is resumed.
     */
    public void onSessionUpdated(Session session) {
        if (session == null || session.id() == null) {
            return;
        }
        var state = sessions.find(session.id()).orElse(null);
        if (state == null) {
            log.debug("Update for unknown session {} ignored", session.id());
            return;
        }
        state.updateSession(session);
        if (session.status().isTerminal()) {
            handleTerminal(state, session.status());
            return;
        }
        if (state.isAutoPlayEnabled() && !state.isExecuting() && session.nextPendingInteraction().isPresent()) {
            executeNext(session.id());
        }
    }

    /**
     * Toggles auto-play. Enabling it while idle starts a step; enabling it while
     * executing only affects what happens after the current step. Disabling it
     * never interrupts the step in flight.
     */
    public void setAutoPlay(String sessionId, boolean enabled) {
        var state = sessions.getOrCreate(sessionId);
        state.setAutoPlayEnabled(enabled);
        log.info("Session {}: auto-play {}", sessionId, enabled ? "enabled" : "disabled");
        if (enabled && !state.isExecuting()) {
            executeNext(sessionId);
        }
    }

    /**
     * Starts driving a session from this process: with {@code autoPlay} every step
     * follows the previous one's completion, otherwise a single step is started.
     *
     * @return the session's terminal future, captured before the first step so a
     *         session that ends immediately is still observed
     */
    public CompletableFuture<SessionStatus> attach(String sessionId, boolean autoPlay) {
        var terminal = sessions.getOrCreate(sessionId).terminalFuture();
        if (autoPlay) {
            setAutoPlay(sessionId, true);
        } else {
            executeNext(sessionId);
        }
        return terminal;
    }

    /**
     * Stops the session's callback bridge, deletes its scratch files and drops its
     * state. Safe to call for sessions that never created some of these, or that
     * were never seen at all.
     */
    public void cleanup(String sessionId) {
        var state = sessions.remove(sessionId);
        if (state != null && !state.isTerminal()) {
            state.setAutoPlayEnabled(false);
            state.terminalFuture().cancel(false);
        }
        bridges.release(sessionId);
        resources.cleanup(sessionId);
        log.info("Session {}: cleaned up", sessionId);
    }

    private CompletableFuture<Void> runStep(SessionState state, Session session) {
        String sessionId = state.getSessionId();
        state.updateSession(session);

        if (session.status().isTerminal()) {
            state.endExecution();
            handleTerminal(state, session.status());
            return CompletableFuture.completedFuture(null);
        }

        var pending = session.nextPendingInteraction();
        if (pending.isEmpty()) {
            log.info("Session {}: no pending interaction", sessionId);
            state.endExecution();
            return CompletableFuture.completedFuture(null);
        }

        var interaction = pending.get();
        state.assignInteraction(interaction.id());
        if (!interaction.command().childSessionIds().isEmpty()) {
            return runParallel(state, interaction);
        }

        CommandExecutor executor = executors.select(session.executionMode(),
                CommandKind.of(interaction.command(), agentCommand));
        MdcContext.setInteraction(sessionId, interaction.id(), executor.kind().name());
        try {
            log.info("Session {}: running interaction {} with {}", sessionId, interaction.id(), executor.kind());
            CompletableFuture<CommandResult> result;
            try {
                result = executor.execute(sessionId, interaction, session);
            } catch (CommandValidationException | CallbackBridgeException e) {
                log.error("Session {}: interaction {} rejected: {}", sessionId, interaction.id(), e.getMessage());
                result = CompletableFuture.completedFuture(CommandResult.failure(e.getMessage(), 0));
            }
            return result.thenAccept(r -> submit(state, interaction.id(), r));
        } finally {
            MdcContext.clear();
        }
    }

    private CompletableFuture<Void> runParallel(SessionState parent, Interaction interaction) {
        var childIds = interaction.command().childSessionIds();
        long startNanos = System.nanoTime();
        log.info("Session {}: interaction {} fans out to {} child session(s) {}",
                parent.getSessionId(), interaction.id(), childIds.size(), childIds);
        if (interaction.command().metadata().get(Command.CHILD_SESSION_IDS) instanceof List<?> raw
                && raw.size() != childIds.size()) {
            log.warn("Session {}: interaction {} lists {} child id(s), running {} distinct",
                    parent.getSessionId(), interaction.id(), raw.size(), childIds.size());
        }
        if (metrics != null) metrics.recordParallelFanOut(childIds.size());

        var outcomes = new LinkedHashMap<String, CompletableFuture<SessionStatus>>();
        for (String childId : childIds) {
            var child = sessions.getOrCreate(childId);
            child.setAutoPlayEnabled(true);
            outcomes.put(childId, child.terminalFuture());
            executeNext(childId);
        }

        var settled = outcomes.values().stream()
                .map(f -> f.handle((status, error) -> null))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(settled)
                .thenAccept(ignored -> submit(parent, interaction.id(),
                        aggregateChildren(outcomes, (System.nanoTime() - startNanos) / 1_000_000)));
    }

    /**
     * Folds settled child outcomes into one result. A child that ended with
     * {@code failed}, or never reached a terminal status, counts as failed.
     */
    static CommandResult aggregateChildren(Map<String, CompletableFuture<SessionStatus>> outcomes, long durationMs) {
        int failed = 0;
        var details = new StringBuilder();
        for (var entry : outcomes.entrySet()) {
            var future = entry.getValue();
            SessionStatus status = future.isDone() && !future.isCompletedExceptionally() ? future.join() : null;
            boolean childFailed = status != SessionStatus.COMPLETE;
            if (childFailed) failed++;
            details.append("\n  ").append(entry.getKey()).append(": ")
                    .append(status == null ? "abandoned" : status.wireName());
        }
        int total = outcomes.size();
        String summary = "Parallel execution: %d children, %d succeeded, %d failed"
                .formatted(total, total - failed, failed);
        return failed == 0
                ? new CommandResult(summary + details, "", 0, durationMs)
                : new CommandResult(summary + details,
                        "%d of %d child sessions failed".formatted(failed, total), 1, durationMs);
    }

    private void submit(SessionState state, String interactionId, CommandResult result) {
        String sessionId = state.getSessionId();
        var submission = ResultSubmission.from(result);
        try {
            remoteStore.submitResult(sessionId, interactionId, submission);
            log.info("Session {}: submitted {} result for interaction {}",
                    sessionId, submission.status().wireName(), interactionId);
        } catch (RemoteStoreException e) {
            // no completion notification will follow; go idle so a manual trigger can retry
            log.warn("Session {}: result submission for {} failed: {}", sessionId, interactionId, e.getMessage());
            if (metrics != null) metrics.recordRemoteFailure("submit_result");
            state.completeExecution(interactionId);
        }
    }

    private void handleTerminal(SessionState state, SessionStatus status) {
        if (!state.markTerminal(status)) {
            return;
        }
        log.info("Session {} reached terminal status {}", state.getSessionId(), status.wireName());
        cleanup(state.getSessionId());
    }
}
