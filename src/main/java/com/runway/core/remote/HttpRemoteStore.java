package com.runway.core.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runway.core.events.RemoteEvent;
import com.runway.core.model.ResultSubmission;
import com.runway.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * REST client for the remote session store.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET  /api/sessions/{id}/next-command}</li>
 *   <li>{@code POST /api/sessions/{id}/interactions/{interactionId}/result}</li>
 *   <li>{@code POST /api/sessions/{id}/events}</li>
 * </ul>
 *
 * <p>When a token is configured it is sent as a bearer token.
 */
@Service
public class HttpRemoteStore implements RemoteStore {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteStore.class);

    private final RemoteStoreProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpRemoteStore(RemoteStoreProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
    }

    @Override
    public Session getNextCommand(String sessionId) {
        String path = "/api/sessions/" + encode(sessionId) + "/next-command";
        String body = send("GET", path, null);
        try {
            return objectMapper.readValue(body, Session.class);
        } catch (JsonProcessingException e) {
            throw new RemoteStoreException("Malformed session returned by GET " + path, e);
        }
    }

    @Override
    public void submitResult(String sessionId, String interactionId, ResultSubmission result) {
        String path = "/api/sessions/" + encode(sessionId)
                + "/interactions/" + encode(interactionId) + "/result";
        send("POST", path, toJson(result));
        log.debug("Submitted result for {}/{} (status={})", sessionId, interactionId, result.status());
    }

    @Override
    public void postEvent(RemoteEvent event) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("interactionId", event.interactionId());
        body.put("eventType", event.eventType());
        body.set("eventData", objectMapper.valueToTree(event.eventData()));
        body.put("timestamp", event.timestamp().toString());
        send("POST", "/api/sessions/" + encode(event.sessionId()) + "/events", body.toString());
    }

    private String send(String method, String path, String jsonBody) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.normalizedBaseUrl() + path))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Accept", "application/json");
        if (properties.hasToken()) {
            builder.header("Authorization", "Bearer " + properties.getToken());
        }
        if (jsonBody != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new RemoteStoreException("Remote store %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()),
                        response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new RemoteStoreException("Remote store request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteStoreException("Interrupted during remote store request: " + method + " " + path, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
