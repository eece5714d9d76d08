package com.runway.core.engine;

import com.runway.core.model.ExecutionMode;
import com.runway.core.model.Session;
import com.runway.core.model.SessionStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Local, transient state of one session. Mutated only by {@link SessionOrchestrator}.
 *
 * <p>{@code executing} and {@code currentInteractionId} change together under this
 * object's lock; they enforce at most one in-flight executor call per session.
 */
public class SessionState {

    private final String sessionId;
    private final CompletableFuture<SessionStatus> terminalFuture = new CompletableFuture<>();

    private volatile Session session;
    private volatile boolean autoPlayEnabled;

    private boolean executing;
    private String currentInteractionId;

    SessionState(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /** Last snapshot received from the remote store, null before the first one. */
    public Session getSession() {
        return session;
    }

    void updateSession(Session session) {
        this.session = session;
    }

    public boolean isAutoPlayEnabled() {
        return autoPlayEnabled;
    }

    void setAutoPlayEnabled(boolean enabled) {
        this.autoPlayEnabled = enabled;
    }

    public synchronized boolean isExecuting() {
        return executing;
    }

    public synchronized String getCurrentInteractionId() {
        return currentInteractionId;
    }

    /**
     * idle to executing.
     *
     * @return false when a step is already in flight or the session has ended
     */
    synchronized boolean tryBeginExecution() {
        if (executing || terminalFuture.isDone()) {
            return false;
        }
        executing = true;
        currentInteractionId = null;
        return true;
    }

    synchronized void assignInteraction(String interactionId) {
        this.currentInteractionId = interactionId;
    }

    /**
     * executing to idle on the completion notification for {@code interactionId}.
     *
     * @return false when that interaction is not the one in flight (duplicate or stale notification)
     */
    synchronized boolean completeExecution(String interactionId) {
        if (!executing || currentInteractionId == null || !currentInteractionId.equals(interactionId)) {
            return false;
        }
        executing = false;
        currentInteractionId = null;
        return true;
    }

    /** executing to idle without a completion notification (nothing to run, or the step failed). */
    synchronized void endExecution() {
        executing = false;
        currentInteractionId = null;
    }

    /**
     * Completes with the terminal status once the remote store reports one, or
     * exceptionally when the session is cleaned up before that.
     */
    public CompletableFuture<SessionStatus> terminalFuture() {
        return terminalFuture;
    }

    public boolean isTerminal() {
        return terminalFuture.isDone();
    }

    /**
     * @return true only for the first call
     */
    boolean markTerminal(SessionStatus status) {
        autoPlayEnabled = false;
        return terminalFuture.complete(status);
    }

    public synchronized Snapshot snapshot() {
        var cached = session;
        return new Snapshot(sessionId, autoPlayEnabled, executing, currentInteractionId,
                cached == null ? null : cached.status(),
                cached == null ? null : cached.executionMode());
    }

    /**
     * Read-only view served by the session control endpoint.
     */
    public record Snapshot(
        String sessionId,
        boolean autoPlayEnabled,
        boolean executing,
        String currentInteractionId,
        SessionStatus status,
        ExecutionMode executionMode
    ) {}
}
