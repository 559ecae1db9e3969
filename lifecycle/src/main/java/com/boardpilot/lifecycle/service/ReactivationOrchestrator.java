package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.executor.ExecutorClient;
import com.boardpilot.lifecycle.executor.dto.WorkDescriptor;
import com.boardpilot.lifecycle.logging.MdcContext;
import com.boardpilot.lifecycle.metrics.ReactivationMetrics;
import com.boardpilot.lifecycle.model.*;
import com.boardpilot.lifecycle.repository.ReactivationAttemptRepository;
import com.boardpilot.lifecycle.repository.RunRepository;
import com.boardpilot.lifecycle.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides, for one trigger at a time, whether a task may (re)enter execution.
 *
 * Request lifecycle:
 *   Received   ledger entry inserted with decision = PENDING
 *   Locking    fail-fast task lock; busy means CONCURRENT_ATTEMPT
 *   Evaluating ceiling, cooldown, transition table, live-job guard (in that order)
 *   Accepted   revoke old jobs, write status, open/continue run, submit job,
 *              register job, count the reactivation, set the cooldown
 *   Rejected   no status change; counted reasons push the cooldown out
 *   Completed  lock released, ledger entry stamped
 *
 * Evaluation and its writes run in one transaction together with the ledger
 * completion. The lock is held only until that transaction commits, never
 * while the submitted job runs.
 *
 * {@link #submit} never throws for a decision outcome; the only exception
 * that escapes is {@link TaskNotFoundException} for an unknown task id.
 */
@Service
public class ReactivationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReactivationOrchestrator.class);

    private final TaskLifecycleService          lifecycle;
    private final LockManager                   lockManager;
    private final CooldownPolicy                cooldownPolicy;
    private final TransitionValidator           validator;
    private final ActiveJobTracker              tracker;
    private final ReactivationLedger            ledger;
    private final ExecutorClient                executorClient;
    private final TaskRepository                taskRepo;
    private final RunRepository                 runRepo;
    private final ReactivationAttemptRepository attemptRepo;
    private final ReactivationMetrics           metrics;
    private final Clock                         clock;
    private final TransactionTemplate           decisionTx;

    public ReactivationOrchestrator(TaskLifecycleService lifecycle,
                                    LockManager lockManager,
                                    CooldownPolicy cooldownPolicy,
                                    TransitionValidator validator,
                                    ActiveJobTracker tracker,
                                    ReactivationLedger ledger,
                                    ExecutorClient executorClient,
                                    TaskRepository taskRepo,
                                    RunRepository runRepo,
                                    ReactivationAttemptRepository attemptRepo,
                                    ReactivationMetrics metrics,
                                    Clock clock,
                                    PlatformTransactionManager txManager) {
        this.lifecycle      = lifecycle;
        this.lockManager    = lockManager;
        this.cooldownPolicy = cooldownPolicy;
        this.validator      = validator;
        this.tracker        = tracker;
        this.ledger         = ledger;
        this.executorClient = executorClient;
        this.taskRepo       = taskRepo;
        this.runRepo        = runRepo;
        this.attemptRepo    = attemptRepo;
        this.metrics        = metrics;
        this.clock          = clock;
        this.decisionTx     = new TransactionTemplate(txManager);
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Process one trigger end to end.
     *
     * @return the completed ledger entry; exactly one is written per call
     * @throws TaskNotFoundException if the request names an unknown task id
     */
    public ReactivationAttempt submit(TriggerRequest req) {
        Task task = lifecycle.resolve(req.taskId(), req.externalId(), req.title());
        ReactivationAttempt opened = ledger.open(task.getId(), req);

        MdcContext.putTask(task.getId());
        MdcContext.putAttempt(opened.getId(), req.triggerType());
        try {
            log.info("Trigger {} from '{}' requests {} for task {}",
                    req.triggerType(), req.triggerSource(), req.requestedStatus(), task.getId());
            ReactivationAttempt result = decide(task.getId(), opened.getId(), req);
            metrics.recordDecision(result);
            if (result.isAccepted()) {
                log.info("Trigger ACCEPTED: job '{}' on run {} ({} previous job(s) revoked)",
                        result.getJobId(), result.getRunId(), result.getPreviousJobsRevoked());
            } else {
                log.info("Trigger REJECTED: {} ({})", result.getRejectionReason(), result.getMessage());
            }
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    // ------------------------------------------------------------------
    // Locking
    // ------------------------------------------------------------------

    private ReactivationAttempt decide(UUID taskId, UUID attemptId, TriggerRequest req) {
        String owner = req.triggerType().name().toLowerCase() + ":" + attemptId;
        Optional<TaskLock> acquired = lockManager.tryAcquire(taskId, owner);
        if (acquired.isEmpty()) {
            return ledger.reject(attemptId, RejectionReason.CONCURRENT_ATTEMPT,
                    "Another trigger is being processed for this task");
        }

        try (TaskLock lock = acquired.get()) {
            return decisionTx.execute(status -> evaluateAndApply(taskId, attemptId, req));
        } catch (RuntimeException e) {
            // Decision rolled back: status, counters and run untouched.
            log.error("Trigger {} for task {} failed, recording INTERNAL_ERROR: {}",
                    attemptId, taskId, e.getMessage(), e);
            return ledger.fail(attemptId, e);
        }
    }

    // ------------------------------------------------------------------
    // Evaluating + Accepted/Rejected (inside the decision transaction)
    // ------------------------------------------------------------------

    private ReactivationAttempt evaluateAndApply(UUID taskId, UUID attemptId, TriggerRequest req) {
        Instant now = clock.instant();
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        ReactivationAttempt attempt = attemptRepo.findById(attemptId).orElseThrow(() ->
                new IllegalStateException("Ledger entry vanished: " + attemptId));
        Optional<Run> openRun = runRepo.findFirstByTaskIdAndStatusOrderByCreatedAtDesc(taskId, RunStatus.ACTIVE);

        boolean restart = validator.isRestart(task.getStatus(), req.requestedStatus(), req.triggerType());
        if (restart) {
            log.info("Manual restart of completed task {}: attempt budget reset (was {} failed)",
                    taskId, task.getFailedReactivationAttempts());
            cooldownPolicy.reset(task);
        }

        Rejection rejection = evaluate(task, openRun, req, now);
        if (rejection != null) {
            if (rejection.reason().countsAgainstCeiling()) {
                cooldownPolicy.onRejected(task, now);
            }
            attempt.reject(rejection.reason(), rejection.message(), rejection.cooldownRemaining(), now);
        } else {
            accept(task, openRun, attempt, req, restart, now);
        }

        task.touch(now);
        taskRepo.save(task);
        attempt.complete(clock.instant());
        return attemptRepo.save(attempt);
    }

    /** @return null when the trigger may proceed */
    private Rejection evaluate(Task task, Optional<Run> openRun, TriggerRequest req, Instant now) {
        CooldownCheck check = cooldownPolicy.check(task, now);
        switch (check.outcome()) {
            case MAX_ATTEMPTS_EXCEEDED:
                return new Rejection(RejectionReason.MAX_REACTIVATIONS_EXCEEDED,
                        "Task has " + task.getFailedReactivationAttempts()
                        + " failed reactivation attempts and will not be reactivated until it completes",
                        null);
            case THROTTLED:
                return new Rejection(RejectionReason.THROTTLED,
                        "Task is in cooldown for another " + check.remaining().toSeconds() + "s",
                        check.remaining());
            default:
                break;
        }

        try {
            validator.validateReentry(task.getStatus(), req.requestedStatus(), req.triggerType());
        } catch (IllegalTransitionException e) {
            return new Rejection(RejectionReason.ILLEGAL_TRANSITION, e.getMessage(), null);
        }

        if (!req.triggerType().supersedesRunningWork() && openRun.map(Run::hasLiveJobs).orElse(false)) {
            return new Rejection(RejectionReason.ALREADY_ACTIVE,
                    "Run " + openRun.get().getId() + " still has live job(s) "
                    + openRun.get().getActiveJobIds() + "; " + req.triggerType()
                    + " triggers do not supersede running work",
                    null);
        }
        return null;
    }

    private void accept(Task task, Optional<Run> openRun, ReactivationAttempt attempt,
                        TriggerRequest req, boolean restart, Instant now) {
        // 1. Supersede whatever is still running for this task.
        int revoked = openRun.map(tracker::revokePrevious).orElse(0);

        // 2. Status write.
        TaskStatus from = task.getStatus();
        if (restart) {
            lifecycle.applyRestart(task, req.requestedStatus());
        } else {
            lifecycle.applyStatus(task, req.requestedStatus());
        }

        // 3. Continue the open run or start a new one.
        boolean isReactivation = task.getReactivationCount() > 0 || from != TaskStatus.PENDING;
        Run run = openRun.orElseGet(() ->
                runRepo.save(new Run(task, isReactivation, task.getReactivationCount(), now)));

        // 4-5. Hand the work to the executor and track the job.
        String jobId = executorClient.submitJob(run.getId(), describeWork(task, run, req));
        cancelIfRolledBack(jobId);
        tracker.registerJob(run, jobId);

        // 6-7. Counters.
        task.recordReactivation(now);
        cooldownPolicy.onAccepted(task, now);

        String message = from == task.getStatus()
                ? "Accepted, status stays " + from
                : "Accepted, " + from + " -> " + task.getStatus();
        attempt.accept(run.getId(), jobId, revoked, message, now);
        MdcContext.putRun(run.getId());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkDescriptor describeWork(Task task, Run run, TriggerRequest req) {
        return new WorkDescriptor(
                task.getId(),
                task.getExternalId(),
                task.getTitle(),
                task.getStatus().name(),
                req.triggerType().name(),
                req.payload(),
                run.isReactivation(),
                run.getReactivationNumber());
    }

    /**
     * The executor accepts the job before our transaction commits. If the
     * commit then fails, nothing references the job any more, so cancel it.
     */
    private void cancelIfRolledBack(String jobId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    return;
                }
                log.warn("Decision rolled back after job '{}' was submitted, cancelling it", jobId);
                try {
                    executorClient.cancelJob(jobId);
                } catch (RuntimeException e) {
                    log.warn("Could not cancel orphaned job '{}': {}", jobId, e.getMessage());
                }
            }
        });
    }

    private record Rejection(RejectionReason reason, String message, Duration cooldownRemaining) {}
}
