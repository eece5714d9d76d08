package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Notifications pushed by the remote store. Both kinds may be delivered more than once.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SessionNotification.SessionUpdated.class, name = "session_updated"),
    @JsonSubTypes.Type(value = SessionNotification.InteractionCompleted.class, name = "interaction_completed")
})
public sealed interface SessionNotification {

    String sessionId();

    /** New session snapshot, including any updated conversation handle. */
    record SessionUpdated(Session session) implements SessionNotification {
        @Override
        public String sessionId() {
            return session == null ? null : session.id();
        }
    }

    /** The remote store has fully processed an interaction. */
    record InteractionCompleted(String sessionId, String interactionId, ResultStatus status)
            implements SessionNotification {}
}
