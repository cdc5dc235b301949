package com.contextbus.api;

import com.contextbus.orchestration.InvalidSubmissionException;
import com.contextbus.orchestration.OrchestrationService;
import com.contextbus.orchestration.SessionOutcome;
import com.contextbus.session.ExecutionSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Job submission.
 *
 * POST /v1/sessions
 * GET  /v1/sessions/{sessionId}/outcome
 */
@RestController
@RequestMapping("/v1/sessions")
public class SessionController {

    private final OrchestrationService orchestrationService;

    public SessionController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    /**
     * Expected request body:
     * {
     *   "job_key": "ACM-22079",
     *   "parameters": { "targetVersion": "2.15", "cluster.name": "qe6" }
     * }
     *
     * Parameters without a namespace are filed under {@code job.}.
     */
    @PostMapping
    public Map<String, Object> submit(@RequestBody Map<String, Object> request) {
        if (!(request.get("job_key") instanceof String jobKey) || jobKey.isBlank()) {
            throw new InvalidSubmissionException("job_key is required");
        }
        Object rawParameters = request.get("parameters");
        if (rawParameters != null && !(rawParameters instanceof Map)) {
            throw new InvalidSubmissionException("parameters must be an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> parameters = rawParameters == null ? Map.of() : (Map<String, Object>) rawParameters;

        ExecutionSession session = orchestrationService.submit(jobKey, parameters);
        return Map.of(
            "status", "accepted",
            "session_id", session.sessionId(),
            "job_key", session.jobKey()
        );
    }

    /** The artifact or halt reason; 404 while the session is still running. */
    @GetMapping("/{sessionId}/outcome")
    public ResponseEntity<SessionOutcome> outcome(@PathVariable String sessionId) {
        return orchestrationService.outcome(sessionId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
