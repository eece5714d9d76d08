package com.runway.core.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.core.events.RemoteEvent;
import com.runway.core.model.CommandResult;
import com.runway.core.model.ExecutionMode;
import com.runway.core.model.ResultSubmission;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpRemoteStoreTest {

    record Recorded(String method, String path, String authorization, String body) {}

    private HttpServer server;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpRemoteStore store;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            try {
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().getRawPath(),
                        exchange.getRequestHeaders().getFirst("Authorization"), body));
                byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(status, bytes.length);
                exchange.getResponseBody().write(bytes);
            } finally {
                exchange.close();
            }
        });
        server.start();

        var properties = new RemoteStoreProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        properties.setToken("secret");
        store = new HttpRemoteStore(properties, objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("getNextCommand decodes the session and sends the bearer token")
    void getNextCommand() {
        responseBody = """
                {"id":"s 1","executionMode":"agentic","status":"active","interactions":[
                  {"id":"i-1","command":{"text":"echo hi","metadata":{}}}]}
                """;

        var session = store.getNextCommand("s 1");

        assertEquals("s 1", session.id());
        assertEquals(ExecutionMode.AGENTIC, session.executionMode());
        assertEquals("echo hi", session.nextPendingInteraction().orElseThrow().command().text());

        var request = requests.get(0);
        assertEquals("GET", request.method());
        assertEquals("/api/sessions/s%201/next-command", request.path());
        assertEquals("Bearer secret", request.authorization());
    }

    @Test
    @DisplayName("submitResult posts the submission as JSON")
    void submitResult() throws Exception {
        store.submitResult("s-1", "i-7", ResultSubmission.from(new CommandResult("", "bad", 3, 10)));

        var request = requests.get(0);
        assertEquals("POST", request.method());
        assertEquals("/api/sessions/s-1/interactions/i-7/result", request.path());
        var json = objectMapper.readTree(request.body());
        assertEquals("error", json.get("status").asText());
        assertEquals(3, json.get("exitCode").asInt());
        assertEquals("Command failed with exit code 3: bad", json.get("message").asText());
    }

    @Test
    @DisplayName("postEvent wraps the raw payload in eventData")
    void postEvent() throws Exception {
        store.postEvent(new RemoteEvent("s-1", "i-1", "Stop", Map.of("hook_event_name", "Stop"),
                Instant.parse("2026-01-02T03:04:05Z")));

        var request = requests.get(0);
        assertEquals("/api/sessions/s-1/events", request.path());
        var json = objectMapper.readTree(request.body());
        assertEquals("i-1", json.get("interactionId").asText());
        assertEquals("Stop", json.get("eventType").asText());
        assertEquals("Stop", json.get("eventData").get("hook_event_name").asText());
        assertEquals("2026-01-02T03:04:05Z", json.get("timestamp").asText());
    }

    @Test
    @DisplayName("HTTP errors surface as RemoteStoreException with the status code")
    void httpError() {
        status = 503;
        responseBody = "{\"error\":\"down\"}";

        var e = assertThrows(RemoteStoreException.class, () -> store.getNextCommand("s-1"));
        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("transport failures surface as RemoteStoreException")
    void transportError() {
        server.stop(0);
        assertThrows(RemoteStoreException.class,
                () -> store.submitResult("s-1", "i-1", ResultSubmission.from(CommandResult.empty())));
    }
}
