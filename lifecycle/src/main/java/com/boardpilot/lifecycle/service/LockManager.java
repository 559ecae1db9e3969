package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.metrics.ReactivationMetrics;
import com.boardpilot.lifecycle.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-task advisory lock stored on the task row itself.
 *
 * Acquire and release are single conditional UPDATEs, each committed in its
 * own transaction so the lock is visible to other callers immediately and
 * survives a rollback of the work done under it. Acquisition is fail-fast:
 * a held, unexpired lock means Busy, we never wait.
 *
 * The sweeper is the only caller allowed to clear a lock it does not own.
 */
@Service
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final TaskRepository         taskRepo;
    private final ReactivationProperties props;
    private final ReactivationMetrics    metrics;
    private final Clock                  clock;
    private final TransactionTemplate    requiresNew;

    public LockManager(TaskRepository taskRepo,
                       ReactivationProperties props,
                       ReactivationMetrics metrics,
                       Clock clock,
                       PlatformTransactionManager txManager) {
        this.taskRepo    = taskRepo;
        this.props       = props;
        this.metrics     = metrics;
        this.clock       = clock;
        this.requiresNew = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ------------------------------------------------------------------
    // Scoped acquisition
    // ------------------------------------------------------------------

    /**
     * Try to take the lock for {@code owner}.
     *
     * A lock whose holder took it more than lock-ttl ago counts as free, so a
     * crashed owner delays other callers by at most one ttl even before the
     * sweeper runs.
     *
     * @return the handle, or empty if another owner holds a live lock
     */
    public Optional<TaskLock> tryAcquire(UUID taskId, String owner) {
        Instant now           = clock.instant();
        Instant expiredBefore = now.minus(props.getLockTtl());
        Integer updated = requiresNew.execute(status ->
                taskRepo.tryAcquireLock(taskId, owner, now, expiredBefore));

        if (updated == null || updated == 0) {
            log.debug("Lock on task {} busy, '{}' turned away", taskId, owner);
            return Optional.empty();
        }
        log.debug("Lock on task {} acquired by '{}'", taskId, owner);
        return Optional.of(new TaskLock(this, taskId, owner, now));
    }

    /**
     * Clear the lock if {@code lock}'s owner still holds it. Called by
     * {@link TaskLock#close()}; a zero-row update means the lock expired and
     * was swept or taken over while we held it.
     */
    void release(TaskLock lock) {
        Integer updated = requiresNew.execute(status ->
                taskRepo.releaseLock(lock.getTaskId(), lock.getOwner()));
        if (updated == null || updated == 0) {
            log.warn("Lock on task {} was no longer held by '{}' at release (held for {})",
                    lock.getTaskId(), lock.getOwner(),
                    Duration.between(lock.getAcquiredAt(), clock.instant()));
        } else {
            log.debug("Lock on task {} released by '{}'", lock.getTaskId(), lock.getOwner());
        }
    }

    // ------------------------------------------------------------------
    // Janitor operations
    // ------------------------------------------------------------------

    /**
     * Force-clear every lock older than {@code maxAge}. Idempotent and safe to
     * run alongside acquire/release: it only matches rows whose locked_at is
     * older than the cutoff, which a fresh acquire never leaves behind.
     *
     * @return number of locks cleared
     */
    public int sweepExpired(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        Integer cleared = requiresNew.execute(status -> taskRepo.clearLocksOlderThan(cutoff));
        int count = cleared == null ? 0 : cleared;
        if (count > 0) {
            log.warn("Force-cleared {} task lock(s) older than {}", count, maxAge);
            metrics.recordLocksSwept(count);
        }
        return count;
    }

    public int sweepExpired() {
        return sweepExpired(props.getLockTtl());
    }

    /** Operator action: clear every lock regardless of age or owner. */
    public int forceReleaseAll() {
        Integer cleared = requiresNew.execute(status -> taskRepo.clearAllLocks());
        int count = cleared == null ? 0 : cleared;
        log.warn("Operator released all task locks ({} cleared)", count);
        metrics.recordLocksSwept(count);
        return count;
    }
}
