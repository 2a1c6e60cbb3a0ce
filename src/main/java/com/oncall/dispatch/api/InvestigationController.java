package com.oncall.dispatch.api;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.engine.InvestigationEngine;
import com.oncall.core.engine.InvestigationResult;
import com.oncall.core.engine.SessionOptions;
import com.oncall.core.error.InvestigationException;
import com.oncall.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for investigation sessions.
 */
@RestController
@RequestMapping("/api/v1/investigations")
public class InvestigationController {

    private static final Logger log = LoggerFactory.getLogger(InvestigationController.class);

    private final InvestigationEngine engine;
    private final InvestigatorProperties properties;

    public InvestigationController(InvestigationEngine engine, InvestigatorProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * POST /api/v1/investigations: start a session. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody InvestigationRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Query text is required"));
        }

        SessionOptions options;
        try {
            options = SessionOptions.defaults(properties)
                    .withMaxRetries(request.maxRetries())
                    .withTimeout(request.timeoutSeconds() != null
                            ? Duration.ofSeconds(request.timeoutSeconds()) : null);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        String sessionId = engine.submitAsync(request.query(), options);
        log.info("Accepted investigation {}", sessionId);
        return ResponseEntity.accepted().body(Map.of(
                "session_id", sessionId,
                "status", SessionStatus.VALIDATING.name()));
    }

    /**
     * GET /api/v1/investigations/{id}: latest state, including the report once finished.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        Optional<InvestigationResult> result;
        try {
            result = engine.status(id);
        } catch (InvestigationException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "session_id", id,
                    "status", "FAILED",
                    "error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
        if (result.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(InvestigationResponse.from(result.get()));
    }

    /**
     * POST /api/v1/investigations/{id}/cancel: request cooperative cancellation.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (engine.cancel(id)) {
            return ResponseEntity.accepted().body(Map.of("session_id", id, "status", "CANCELLING"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "session_id", id,
                "error", "Session is not running"));
    }
}
