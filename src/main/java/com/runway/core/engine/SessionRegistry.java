package com.runway.core.engine;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session id to {@link SessionState}. Owned by one {@link SessionOrchestrator}.
 */
public class SessionRegistry {

    private final ConcurrentHashMap<String, SessionState> states = new ConcurrentHashMap<>();

    SessionState getOrCreate(String sessionId) {
        return states.computeIfAbsent(sessionId, SessionState::new);
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(states.get(sessionId));
    }

    SessionState remove(String sessionId) {
        return states.remove(sessionId);
    }

    public Collection<SessionState> all() {
        return List.copyOf(states.values());
    }

    public int size() {
        return states.size();
    }
}
