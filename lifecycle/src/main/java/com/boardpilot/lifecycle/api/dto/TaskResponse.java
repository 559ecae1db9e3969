package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.Task;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the /tasks endpoints, including the current lock holder.
 */
public record TaskResponse(
        UUID    id,
        String  externalId,
        String  title,
        String  status,
        String  previousStatus,
        boolean locked,
        String  lockedBy,
        Instant lockedAt,
        int     reactivationCount,
        int     failedReactivationAttempts,
        Instant lastReactivationAttempt,
        Instant cooldownUntil,
        Instant reactivatedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getExternalId(),
                t.getTitle(),
                t.getStatus().name(),
                t.getPreviousStatus() == null ? null : t.getPreviousStatus().name(),
                t.isLocked(),
                t.getLockedBy(),
                t.getLockedAt(),
                t.getReactivationCount(),
                t.getFailedReactivationAttempts(),
                t.getLastReactivationAttempt(),
                t.getCooldownUntil(),
                t.getReactivatedAt(),
                t.getCreatedAt(),
                t.getUpdatedAt()
        );
    }
}
