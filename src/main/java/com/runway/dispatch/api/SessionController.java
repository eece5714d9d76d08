package com.runway.dispatch.api;

import com.runway.core.engine.SessionOrchestrator;
import com.runway.core.engine.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Local session control: inspect state, toggle auto-play, trigger a step, clean up.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionOrchestrator orchestrator;

    public SessionController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<SessionState.Snapshot> list() {
        return orchestrator.sessions().all().stream()
                .map(SessionState::snapshot)
                .toList();
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionState.Snapshot> get(@PathVariable String sessionId) {
        return orchestrator.find(sessionId)
                .map(state -> ResponseEntity.ok(state.snapshot()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{sessionId}/auto-play")
    public ResponseEntity<?> autoPlay(@PathVariable String sessionId,
                                      @RequestBody(required = false) Map<String, Object> body) {
        Object enabled = body == null ? null : body.get("enabled");
        if (!(enabled instanceof Boolean flag)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Body must be {\"enabled\": true|false}"));
        }
        orchestrator.setAutoPlay(sessionId, flag);
        return orchestrator.find(sessionId)
                .<ResponseEntity<?>>map(state -> ResponseEntity.ok(state.snapshot()))
                .orElse(ResponseEntity.ok(Map.of("sessionId", sessionId, "autoPlayEnabled", flag)));
    }

    @PostMapping("/{sessionId}/execute-next")
    public ResponseEntity<Map<String, Object>> executeNext(@PathVariable String sessionId) {
        boolean started = orchestrator.executeNext(sessionId);
        if (!started) {
            log.info("Manual trigger for session {} ignored, a step is already in flight", sessionId);
        }
        return ResponseEntity.accepted().body(Map.of("sessionId", sessionId, "started", started));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> cleanup(@PathVariable String sessionId) {
        orchestrator.cleanup(sessionId);
        return ResponseEntity.noContent().build();
    }
}
