package com.runway.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.core.engine.SessionOrchestrator;
import com.runway.core.model.SessionNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Push channel from the remote store. Accepts {@code session_updated} and
 * {@code interaction_completed} notifications; both may be re-delivered safely.
 */
@RestController
@RequestMapping("/api/v1")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final SessionOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public NotificationController(SessionOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/notifications", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> receive(@RequestBody String body) {
        SessionNotification notification;
        try {
            notification = objectMapper.readValue(body, SessionNotification.class);
        } catch (JsonProcessingException e) {
            log.warn("Rejected malformed notification: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Malformed notification: " + e.getOriginalMessage()));
        }
        if (notification == null || notification.sessionId() == null || notification.sessionId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Notification has no session id"));
        }

        if (notification instanceof SessionNotification.SessionUpdated updated) {
            log.debug("session_updated for {} (status {})", updated.sessionId(), updated.session().status());
            orchestrator.onSessionUpdated(updated.session());
            return ResponseEntity.accepted().body(Map.of(
                    "type", "session_updated",
                    "sessionId", updated.sessionId()));
        }

        var completed = (SessionNotification.InteractionCompleted) notification;
        if (completed.interactionId() == null || completed.interactionId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "interaction_completed requires interactionId"));
        }
        boolean advanced = orchestrator.onInteractionCompleted(completed.sessionId(), completed.interactionId());
        return ResponseEntity.accepted().body(Map.of(
                "type", "interaction_completed",
                "sessionId", completed.sessionId(),
                "interactionId", completed.interactionId(),
                "advanced", advanced));
    }
}
