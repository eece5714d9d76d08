package com.runway.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.remote.RemoteStore;
import com.runway.executor.ExecutionProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the callback bridges, one per session, created lazily on first need and
 * stopped on session cleanup.
 */
@Service
public class CallbackBridgeRegistry {

    private static final Logger log = LoggerFactory.getLogger(CallbackBridgeRegistry.class);

    private final RemoteStore remoteStore;
    private final ObjectMapper objectMapper;
    private final RunwayMetrics metrics;
    private final ExecutionProperties properties;

    private final ConcurrentHashMap<String, CallbackBridge> bridges = new ConcurrentHashMap<>();

    public CallbackBridgeRegistry(RemoteStore remoteStore, ObjectMapper objectMapper,
                                  RunwayMetrics metrics, ExecutionProperties properties) {
        this.remoteStore = remoteStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Returns the session's started bridge, creating and starting it on first use.
     *
     * @throws CallbackBridgeException if a new bridge cannot bind
     */
    public CallbackBridge getOrStart(String sessionId) {
        return bridges.computeIfAbsent(sessionId, id -> {
            var bridge = new CallbackBridge(id, remoteStore, objectMapper, metrics,
                    properties.getBridgePathPrefix(), properties.getBridgeThreads());
            bridge.start();
            return bridge;
        });
    }

    public Optional<CallbackBridge> find(String sessionId) {
        return Optional.ofNullable(bridges.get(sessionId));
    }

    /**
     * Stops and forgets the session's bridge. Safe when the session never had one.
     */
    public void release(String sessionId) {
        var bridge = bridges.remove(sessionId);
        if (bridge != null) {
            bridge.stop();
        }
    }

    public int activeCount() {
        return bridges.size();
    }

    @PreDestroy
    void stopAll() {
        if (!bridges.isEmpty()) {
            log.info("Stopping {} callback bridge(s)", bridges.size());
        }
        for (String sessionId : bridges.keySet()) {
            release(sessionId);
        }
    }
}
