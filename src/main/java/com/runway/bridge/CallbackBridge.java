package com.runway.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.core.events.RemoteEvent;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.remote.RemoteStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Per-session local HTTP listener that receives hook deliveries from the
 * interactive agent, forwards them to the remote store and signals local completion.
 *
 * <p>Deliveries are {@code POST <prefix>/<interactionId>} with an opaque body.
 * A registered handler fires at most once: it is removed atomically on the first
 * delivery, so a second delivery for the same id is answered with 404.
 *
 * <p>A registration whose local waiter has given up can be expired: it no longer
 * blocks a new handler for the same id, and a late delivery for it is still
 * forwarded and answered with 200.
 *
 * <p>The listener binds to the loopback interface only and performs no
 * authentication. Interaction ids are short-lived, high-entropy nonces, and only
 * processes on this machine can reach the port.
 */
public class CallbackBridge {

    private static final Logger log = LoggerFactory.getLogger(CallbackBridge.class);

    static final String DEFAULT_EVENT_TYPE = "hook";

    private final String sessionId;
    private final RemoteStore remoteStore;
    private final ObjectMapper objectMapper;
    private final RunwayMetrics metrics;
    private final String pathPrefix;
    private final int threads;

    private final ConcurrentHashMap<String, Consumer<Object>> registrations = new ConcurrentHashMap<>();
    private final Set<String> forwardOnly = ConcurrentHashMap.newKeySet();

    private HttpServer server;
    private ExecutorService executor;
    private volatile int port = -1;

    public CallbackBridge(String sessionId, RemoteStore remoteStore, ObjectMapper objectMapper,
                          RunwayMetrics metrics, String pathPrefix, int threads) {
        this.sessionId = sessionId;
        this.remoteStore = remoteStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.pathPrefix = normalizePrefix(pathPrefix);
        this.threads = Math.max(1, threads);
    }

    /**
     * Binds the listener on an OS-assigned loopback port. Calling it again on a
     * started bridge has no effect.
     *
     * @throws CallbackBridgeException if the listener cannot bind
     */
    public synchronized void start() {
        if (server != null) {
            return;
        }
        try {
            var address = new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
            var httpServer = HttpServer.create(address, 0);
            httpServer.createContext(pathPrefix + "/", this::handleDelivery);
            var counter = new AtomicInteger();
            executor = Executors.newFixedThreadPool(threads, r -> {
                Thread t = new Thread(r, "callback-bridge-" + sessionId + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            httpServer.setExecutor(executor);
            httpServer.start();
            server = httpServer;
            port = httpServer.getAddress().getPort();
            log.info("Callback bridge for session {} listening on 127.0.0.1:{}", sessionId, port);
        } catch (IOException e) {
            if (executor != null) {
                executor.shutdownNow();
                executor = null;
            }
            throw new CallbackBridgeException("Failed to bind callback bridge for session " + sessionId, e);
        }
    }

    /**
     * Closes the listener and discards all pending registrations.
     */
    public synchronized void stop() {
        int discarded = registrations.size();
        registrations.clear();
        forwardOnly.clear();
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        port = -1;
        log.info("Callback bridge for session {} stopped ({} pending registration(s) discarded)",
                sessionId, discarded);
    }

    public boolean isStarted() {
        return port > 0;
    }

    public int getPort() {
        return port;
    }

    /**
     * @throws CallbackBridgeException if the listener has not been started
     */
    public String getCallbackUrl(String interactionId) {
        if (!isStarted()) {
            throw new CallbackBridgeException("Callback bridge for session " + sessionId + " is not started");
        }
        return "http://127.0.0.1:" + port + pathPrefix + "/"
                + URLEncoder.encode(interactionId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Registers a one-time handler invoked with the raw hook payload.
     *
     * @throws CallbackBridgeException if a handler is already registered for the id
     */
    public void onCommandComplete(String interactionId, Consumer<Object> handler) {
        if (forwardOnly.remove(interactionId)) {
            log.debug("New handler for {}/{} supersedes an expired registration", sessionId, interactionId);
        }
        var existing = registrations.putIfAbsent(interactionId, handler);
        if (existing != null) {
            throw new CallbackBridgeException("A completion handler is already registered for interaction "
                    + interactionId);
        }
        log.debug("Registered completion handler for {}/{}", sessionId, interactionId);
    }

    /**
     * Drops a registration without firing it. Returns true if one was present.
     */
    public boolean cancel(String interactionId) {
        return registrations.remove(interactionId) != null;
    }

    /**
     * Drops the handler of a registration nobody waits for any more and keeps the
     * id for forwarding only. Returns true if a handler was pending.
     */
    public boolean expire(String interactionId) {
        if (registrations.remove(interactionId) == null) {
            return false;
        }
        forwardOnly.add(interactionId);
        return true;
    }

    public int forwardOnlyCount() {
        return forwardOnly.size();
    }

    public int pendingCount() {
        return registrations.size();
    }

    public String getSessionId() {
        return sessionId;
    }

    void handleDelivery(HttpExchange exchange) throws IOException {
        try {
            dispatch(exchange);
        } finally {
            exchange.close();
        }
    }

    private void dispatch(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            respond(exchange, 405, Map.of("error", "Method not allowed"));
            return;
        }

        String interactionId = extractInteractionId(exchange.getRequestURI().getRawPath());
        if (interactionId == null || interactionId.isBlank()) {
            respond(exchange, 400, Map.of("error", "Missing interaction id"));
            return;
        }

        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }

        var handler = registrations.remove(interactionId);
        if (handler == null && forwardOnly.remove(interactionId)) {
            log.warn("Late hook delivery for {}/{}; forwarding only", sessionId, interactionId);
            if (metrics != null) metrics.recordBridgeDelivery(false);
            forward(interactionId, decodePayload(body));
            respond(exchange, 200, Map.of("status", "forwarded"));
            return;
        }
        if (handler == null) {
            log.warn("Hook delivery for {}/{} has no pending handler (late or duplicate delivery)",
                    sessionId, interactionId);
            if (metrics != null) metrics.recordBridgeDelivery(false);
            respond(exchange, 404, Map.of("error", "No pending interaction " + interactionId));
            return;
        }
        if (metrics != null) metrics.recordBridgeDelivery(true);

        Object payload = decodePayload(body);
        forward(interactionId, payload);

        try {
            handler.accept(payload);
        } catch (RuntimeException e) {
            log.error("Completion handler for {}/{} failed", sessionId, interactionId, e);
        }
        respond(exchange, 200, Map.of("status", "ok"));
    }

    private void forward(String interactionId, Object payload) {
        var event = new RemoteEvent(sessionId, interactionId, eventTypeOf(payload), payload, Instant.now());
        try {
            remoteStore.postEvent(event);
        } catch (RuntimeException e) {
            log.warn("Failed to forward hook event for {}/{}: {}", sessionId, interactionId, e.getMessage());
            if (metrics != null) metrics.recordRemoteFailure("post_event");
        }
    }

    /**
     * Hook payloads are JSON objects; anything else is kept as text.
     */
    Object decodePayload(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }

    static String eventTypeOf(Object payload) {
        if (payload instanceof Map<?, ?> map && map.get("hook_event_name") instanceof String name && !name.isBlank()) {
            return name;
        }
        return DEFAULT_EVENT_TYPE;
    }

    private String extractInteractionId(String rawPath) {
        String prefix = pathPrefix + "/";
        if (rawPath == null || !rawPath.startsWith(prefix)) {
            return null;
        }
        String remainder = rawPath.substring(prefix.length());
        if (remainder.endsWith("/")) {
            remainder = remainder.substring(0, remainder.length() - 1);
        }
        if (remainder.contains("/")) {
            return null;
        }
        return URLDecoder.decode(remainder, StandardCharsets.UTF_8);
    }

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePrefix(String prefix) {
        String p = prefix == null || prefix.isBlank() ? "/callback" : prefix.trim();
        if (!p.startsWith("/")) p = "/" + p;
        while (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}
