package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a session owned by the remote store. The orchestrator only ever holds
 * an eventually-consistent copy.
 *
 * @param id                 session identifier
 * @param executionMode      manual (visible) or agentic (background)
 * @param interactions       ordered interactions; the last pending one is the next command
 * @param conversationHandle external agent conversation to resume, nullable
 * @param status             active, complete or failed
 */
public record Session(
    String id,
    ExecutionMode executionMode,
    List<Interaction> interactions,
    String conversationHandle,
    SessionStatus status
) {

    public Session {
        executionMode = executionMode == null ? ExecutionMode.MANUAL : executionMode;
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        status = status == null ? SessionStatus.ACTIVE : status;
    }

    /** The most recent interaction that has no result yet. */
    @JsonIgnore
    public Optional<Interaction> nextPendingInteraction() {
        for (int i = interactions.size() - 1; i >= 0; i--) {
            var interaction = interactions.get(i);
            if (interaction.isPending()) {
                return Optional.of(interaction);
            }
        }
        return Optional.empty();
    }

    public Session withStatus(SessionStatus newStatus) {
        return new Session(id, executionMode, interactions, conversationHandle, newStatus);
    }
}
