package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.api.dto.AttemptResponse;
import com.boardpilot.lifecycle.api.dto.SubmitTriggerRequest;
import com.boardpilot.lifecycle.model.ReactivationAttempt;
import com.boardpilot.lifecycle.service.ReactivationOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /triggers  - ask for a task to be (re)activated
 *
 * The body is always the completed ledger entry. The status code tells an
 * automated caller what to do next:
 *   202 - accepted, a job was submitted
 *   429 - throttled; wait Retry-After seconds
 *   409 - rejected for any other decision reason
 *   500 - internal error while deciding; the task was left untouched
 */
@RestController
@RequestMapping("/triggers")
public class TriggerController {

    private final ReactivationOrchestrator orchestrator;

    public TriggerController(ReactivationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/triggers \
     *     -H "Content-Type: application/json" \
     *     -d '{"externalId":"5012345678","triggerType":"UPDATE","triggerSource":"monday.com"}'
     */
    @PostMapping
    public ResponseEntity<AttemptResponse> submit(@RequestBody SubmitTriggerRequest req) {
        ReactivationAttempt attempt = orchestrator.submit(req.toTriggerRequest());
        AttemptResponse body = AttemptResponse.from(attempt);

        if (attempt.isAccepted()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        return switch (attempt.getRejectionReason()) {
            case THROTTLED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(attempt)))
                    .body(body);
            case INTERNAL_ERROR -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
            default -> ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        };
    }

    // Rounded up so a client that waits exactly this long is past the window.
    private static long retryAfterSeconds(ReactivationAttempt attempt) {
        Long ms = attempt.getCooldownRemainingMs();
        if (ms == null || ms <= 0) return 1;
        return Math.max(1, (ms + 999) / 1000);
    }
}
