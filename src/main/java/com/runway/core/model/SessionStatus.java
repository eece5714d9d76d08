package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a session, as decided by the remote store.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        if (value == null) {
            return ACTIVE;
        }
        return SessionStatus.valueOf(value.trim().toUpperCase());
    }
}
