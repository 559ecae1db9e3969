package com.boardpilot.lifecycle.repository;

import com.boardpilot.lifecycle.model.AttemptDecision;
import com.boardpilot.lifecycle.model.ReactivationAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the reactivation ledger. Rows are inserted and
 * completed by ReactivationLedger; everything else here is a read.
 */
public interface ReactivationAttemptRepository extends JpaRepository<ReactivationAttempt, UUID> {

    List<ReactivationAttempt> findByTaskIdOrderByReceivedAtAsc(UUID taskId);

    List<ReactivationAttempt> findByReceivedAtAfterOrderByReceivedAtDesc(Instant since);

    long countByDecision(AttemptDecision decision);

    long countByTaskId(UUID taskId);

    long countByTaskIdAndDecision(UUID taskId, AttemptDecision decision);

    /** Rows of [RejectionReason, Long]. */
    @Query("""
            SELECT a.rejectionReason, COUNT(a) FROM ReactivationAttempt a
            WHERE a.decision = :decision
            GROUP BY a.rejectionReason
            """)
    List<Object[]> countByReason(@Param("decision") AttemptDecision decision);

    @Query("SELECT AVG(a.durationMs) FROM ReactivationAttempt a WHERE a.durationMs IS NOT NULL")
    Double averageDurationMs();

    @Query("SELECT AVG(a.durationMs) FROM ReactivationAttempt a WHERE a.taskId = :taskId AND a.durationMs IS NOT NULL")
    Double averageDurationMs(@Param("taskId") UUID taskId);

    @Query("SELECT MAX(a.receivedAt) FROM ReactivationAttempt a WHERE a.taskId = :taskId")
    Instant lastReceivedAt(@Param("taskId") UUID taskId);

    /** Rows of [TriggerType, Long], most frequent first. */
    @Query("""
            SELECT a.triggerType, COUNT(a) FROM ReactivationAttempt a
            WHERE a.taskId = :taskId
            GROUP BY a.triggerType
            ORDER BY COUNT(a) DESC
            """)
    List<Object[]> triggerTypeFrequency(@Param("taskId") UUID taskId);
}
