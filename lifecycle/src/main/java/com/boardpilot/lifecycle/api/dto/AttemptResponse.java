package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.ReactivationAttempt;

import java.time.Instant;
import java.util.UUID;

/**
 * One ledger entry. Response body for POST /triggers and the attempt listings.
 */
public record AttemptResponse(
        UUID    id,
        UUID    taskId,
        UUID    runId,
        String  triggerType,
        String  triggerSource,
        String  requestedStatus,
        String  decision,
        String  rejectionReason,
        String  message,
        String  jobId,
        int     previousJobsRevoked,
        Long    cooldownRemainingMs,
        String  errorMessage,
        Instant receivedAt,
        Instant completedAt,
        Long    durationMs
) {
    public static AttemptResponse from(ReactivationAttempt a) {
        return new AttemptResponse(
                a.getId(),
                a.getTaskId(),
                a.getRunId(),
                a.getTriggerType().name(),
                a.getTriggerSource(),
                a.getRequestedStatus().name(),
                a.getDecision().name(),
                a.getRejectionReason() == null ? null : a.getRejectionReason().name(),
                a.getMessage(),
                a.getJobId(),
                a.getPreviousJobsRevoked(),
                a.getCooldownRemainingMs(),
                a.getErrorMessage(),
                a.getReceivedAt(),
                a.getCompletedAt(),
                a.getDurationMs()
        );
    }
}
