package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.executor.ExecutorClient;
import com.boardpilot.lifecycle.logging.MdcContext;
import com.boardpilot.lifecycle.metrics.ReactivationMetrics;
import com.boardpilot.lifecycle.model.JobEvent;
import com.boardpilot.lifecycle.model.Run;
import com.boardpilot.lifecycle.model.RunStatus;
import com.boardpilot.lifecycle.model.Task;
import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Keeps each run's set of live executor job ids.
 *
 * A run with a live job never gets a second submission unless the new work
 * supersedes the old, in which case the old jobs are revoked first. Events
 * for job ids no longer in the set (late callbacks from revoked jobs) are
 * ignored, so a cancelled job can never close the run that replaced it.
 */
@Service
public class ActiveJobTracker {

    private static final Logger log = LoggerFactory.getLogger(ActiveJobTracker.class);

    private final RunRepository        runRepo;
    private final ExecutorClient       executorClient;
    private final TaskLifecycleService lifecycle;
    private final ReactivationMetrics  metrics;
    private final Clock                clock;

    public ActiveJobTracker(RunRepository runRepo,
                            ExecutorClient executorClient,
                            TaskLifecycleService lifecycle,
                            ReactivationMetrics metrics,
                            Clock clock) {
        this.runRepo        = runRepo;
        this.executorClient = executorClient;
        this.lifecycle      = lifecycle;
        this.metrics        = metrics;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Called by the orchestrator inside its decision transaction
    // ------------------------------------------------------------------

    /** @return false if the id was already registered on the run */
    public boolean registerJob(Run run, String jobId) {
        boolean added = run.addJob(jobId, clock.instant());
        if (!added) {
            log.warn("Job '{}' already registered on run {}, ignoring duplicate", jobId, run.getId());
            return false;
        }
        runRepo.save(run);
        if (run.getActiveJobIds().size() > 1) {
            log.warn("Run {} now has {} live jobs: {}", run.getId(),
                    run.getActiveJobIds().size(), run.getActiveJobIds());
        }
        return true;
    }

    /** @return false if the job was not live on the run */
    public boolean completeJob(Run run, String jobId, String outcome) {
        boolean removed = run.removeJob(jobId, outcome);
        if (removed) {
            runRepo.save(run);
        }
        return removed;
    }

    /**
     * Clear the run's live set and cancel the jobs it held.
     *
     * The clear is part of the caller's transaction. The cancels are sent
     * only once that transaction commits: on rollback the set comes back
     * unchanged and its jobs must still be running. Outside a transaction
     * they are sent at once.
     *
     * Best-effort: a cancel the executor refuses or never answers is logged
     * and still counted, since the job id is forgotten either way and any
     * late event it sends will be ignored.
     *
     * @return number of job ids revoked
     */
    public int revokePrevious(Run run) {
        List<String> jobIds = new ArrayList<>(run.getActiveJobIds());
        if (jobIds.isEmpty()) {
            return 0;
        }
        run.clearJobs();
        runRepo.save(run);
        UUID runId = run.getId();
        afterCommit(() -> cancelAll(runId, jobIds));
        log.info("Revoked {} job(s) on run {}: {}", jobIds.size(), runId, jobIds);
        return jobIds.size();
    }

    // ------------------------------------------------------------------
    // Executor callbacks (via JobEventDispatcher)
    // ------------------------------------------------------------------

    /**
     * Apply one executor event. When the last live job of a run finishes the
     * run closes, and the task follows it to COMPLETED or FAILED if the
     * transition table allows it from where the task currently is.
     */
    @Transactional
    public void onJobEvent(UUID runId, String jobId, JobEvent event) {
        Run run = runRepo.findById(runId).orElse(null);
        if (run == null) {
            log.warn("Event {} for job '{}' names unknown run {}, ignoring", event, jobId, runId);
            return;
        }
        MdcContext.putTask(run.getTask().getId());
        if (!run.getActiveJobIds().contains(jobId)) {
            log.info("Event {} for job '{}' ignored: not live on run {} (revoked or already finished)",
                    event, jobId, runId);
            return;
        }

        Instant now = clock.instant();
        switch (event) {
            case STARTED -> {
                run.markJobStarted(now);
                runRepo.save(run);
                log.info("Job '{}' started on run {}", jobId, runId);
            }
            case COMPLETED -> finishJob(run, jobId, "completed", RunStatus.COMPLETED, TaskStatus.COMPLETED, now);
            case FAILED    -> finishJob(run, jobId, "failed",    RunStatus.FAILED,    TaskStatus.FAILED,    now);
        }
    }

    /**
     * Periodic audit: a closed run must hold no live job ids. Any it finds
     * are cancelled at the executor and cleared.
     *
     * @return number of runs repaired
     */
    @Transactional
    public int reconcileClosedRuns() {
        List<Run> broken = runRepo.findClosedWithLiveJobs(RunStatus.ACTIVE);
        for (Run run : broken) {
            log.warn("Run {} is {} but still lists live jobs {}, revoking",
                    run.getId(), run.getStatus(), run.getActiveJobIds());
            revokePrevious(run);
        }
        metrics.recordRunsRepaired(broken.size());
        return broken.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void cancelAll(UUID runId, List<String> jobIds) {
        for (String jobId : jobIds) {
            try {
                executorClient.cancelJob(jobId);
            } catch (RuntimeException e) {
                log.warn("Cancel of job '{}' on run {} failed, forgetting it anyway: {}",
                        jobId, runId, e.getMessage());
            }
        }
        metrics.recordJobsRevoked(jobIds.size());
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void finishJob(Run run, String jobId, String outcome,
                           RunStatus runStatus, TaskStatus taskStatus, Instant now) {
        completeJob(run, jobId, outcome);
        log.info("Job '{}' {} on run {} ({} still live)",
                jobId, outcome, run.getId(), run.getActiveJobIds().size());
        if (run.hasLiveJobs()) {
            return;
        }

        run.close(runStatus, now);
        runRepo.save(run);

        Task task = run.getTask();
        if (task.getStatus().canMoveTo(taskStatus)) {
            lifecycle.applyStatus(task, taskStatus);
        } else {
            log.info("Run {} closed {} but task {} stays {} ({} -> {} not allowed)",
                    run.getId(), runStatus, task.getId(), task.getStatus(), task.getStatus(), taskStatus);
        }
    }
}
