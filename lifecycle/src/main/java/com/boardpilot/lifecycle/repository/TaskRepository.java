package com.boardpilot.lifecycle.repository;

import com.boardpilot.lifecycle.model.Task;
import com.boardpilot.lifecycle.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD, lock primitives and monitoring queries for the tasks table.
 *
 * The lock methods are single conditional UPDATEs: the database decides who
 * wins, there is no read-then-write window between two callers. Each must run
 * inside a transaction (LockManager opens a new one per call).
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    Optional<Task> findByExternalId(String externalId);

    List<Task> findByStatusIn(Collection<TaskStatus> statuses);

    List<Task> findByCooldownUntilAfterOrderByCooldownUntilAsc(Instant now);

    // ------------------------------------------------------------------
    // Lock primitives
    // ------------------------------------------------------------------

    /**
     * Take the lock if it is free or its holder's lease is older than
     * {@code expiredBefore}.
     *
     * @return 1 if this caller now owns the lock, 0 if someone else does
     */
    @Modifying
    @Query(value = """
            UPDATE tasks
               SET is_locked = TRUE, locked_at = :now, locked_by = :owner
             WHERE id = :id
               AND (is_locked = FALSE OR locked_at < :expiredBefore)
            """, nativeQuery = true)
    int tryAcquireLock(@Param("id") UUID id,
                       @Param("owner") String owner,
                       @Param("now") Instant now,
                       @Param("expiredBefore") Instant expiredBefore);

    /** Clear the lock only if {@code owner} still holds it. */
    @Modifying
    @Query(value = """
            UPDATE tasks
               SET is_locked = FALSE, locked_at = NULL, locked_by = NULL
             WHERE id = :id
               AND is_locked = TRUE
               AND locked_by = :owner
            """, nativeQuery = true)
    int releaseLock(@Param("id") UUID id, @Param("owner") String owner);

    /** Clear every lock taken before {@code cutoff}. Safe to run concurrently with acquire/release. */
    @Modifying
    @Query(value = """
            UPDATE tasks
               SET is_locked = FALSE, locked_at = NULL, locked_by = NULL
             WHERE is_locked = TRUE
               AND locked_at < :cutoff
            """, nativeQuery = true)
    int clearLocksOlderThan(@Param("cutoff") Instant cutoff);

    @Modifying
    @Query(value = """
            UPDATE tasks
               SET is_locked = FALSE, locked_at = NULL, locked_by = NULL
             WHERE is_locked = TRUE
            """, nativeQuery = true)
    int clearAllLocks();

    // ------------------------------------------------------------------
    // Aggregates for the stats view
    // ------------------------------------------------------------------

    long countByLockedTrue();

    long countByCooldownUntilAfter(Instant now);

    long countByReactivationCountGreaterThan(int count);

    long countByFailedReactivationAttemptsGreaterThan(int count);

    long countByFailedReactivationAttemptsGreaterThanEqual(int count);

    @Query("SELECT AVG(t.reactivationCount) FROM Task t WHERE t.reactivationCount > 0")
    Double averageReactivationCount();

    @Query("SELECT MAX(t.reactivationCount) FROM Task t")
    Integer maxReactivationCount();
}
