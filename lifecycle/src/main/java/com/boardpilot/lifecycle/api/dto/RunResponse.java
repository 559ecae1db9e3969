package com.boardpilot.lifecycle.api.dto;

import com.boardpilot.lifecycle.model.Run;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /tasks/{id}/runs.
 */
public record RunResponse(
        UUID         id,
        String       status,
        List<String> activeJobIds,
        String       lastJobId,
        String       lastOutcome,
        Instant      jobStartedAt,
        boolean      reactivation,
        int          reactivationNumber,
        Instant      createdAt,
        Instant      closedAt
) {
    public static RunResponse from(Run r) {
        return new RunResponse(
                r.getId(),
                r.getStatus().name(),
                List.copyOf(r.getActiveJobIds()),
                r.getLastJobId(),
                r.getLastOutcome(),
                r.getJobStartedAt(),
                r.isReactivation(),
                r.getReactivationNumber(),
                r.getCreatedAt(),
                r.getClosedAt()
        );
    }
}
