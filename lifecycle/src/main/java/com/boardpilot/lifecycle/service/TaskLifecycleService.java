package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.ReactivationAttempt;
import com.boardpilot.lifecycle.model.Run;
import com.boardpilot.lifecycle.model.Task;
import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.repository.ReactivationAttemptRepository;
import com.boardpilot.lifecycle.repository.RunRepository;
import com.boardpilot.lifecycle.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task registration, lookup and workflow-driven status writes.
 *
 * {@link #applyStatus} is the single place a task's status changes; the
 * orchestrator, the job tracker and the REST status endpoint all go
 * through it so the validator and the completion reset are never skipped.
 */
@Service
public class TaskLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleService.class);

    private final TaskRepository                taskRepo;
    private final RunRepository                 runRepo;
    private final ReactivationAttemptRepository attemptRepo;
    private final TransitionValidator           validator;
    private final CooldownPolicy                cooldownPolicy;
    private final Clock                         clock;

    public TaskLifecycleService(TaskRepository taskRepo,
                                RunRepository runRepo,
                                ReactivationAttemptRepository attemptRepo,
                                TransitionValidator validator,
                                CooldownPolicy cooldownPolicy,
                                Clock clock) {
        this.taskRepo       = taskRepo;
        this.runRepo        = runRepo;
        this.attemptRepo    = attemptRepo;
        this.validator      = validator;
        this.cooldownPolicy = cooldownPolicy;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Registration and lookup
    // ------------------------------------------------------------------

    public Task register(String externalId, String title) {
        Task task = taskRepo.save(new Task(externalId, title, clock.instant()));
        log.info("Registered task {} (externalId={})", task.getId(), externalId);
        return task;
    }

    public Optional<Task> findById(UUID id) {
        return taskRepo.findById(id);
    }

    /**
     * Find the task a trigger refers to.
     *
     * An internal id must exist. A board item id seen for the first time is
     * registered as a new PENDING task; if two triggers race on that insert
     * the unique constraint picks one and the loser re-reads.
     *
     * Not transactional: the insert must commit (or fail) on its
     * own so the re-read after a constraint violation sees the winner's row.
     *
     * @throws TaskNotFoundException if {@code taskId} is given and unknown
     */
    public Task resolve(UUID taskId, String externalId, String title) {
        if (taskId != null) {
            return taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        }
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("Either taskId or externalId is required");
        }
        Optional<Task> existing = taskRepo.findByExternalId(externalId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            Task created = taskRepo.saveAndFlush(new Task(externalId, title, clock.instant()));
            log.info("First trigger for board item '{}', registered task {}", externalId, created.getId());
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent registration of board item '{}', re-reading", externalId);
            return taskRepo.findByExternalId(externalId).orElseThrow(() -> e);
        }
    }

    // ------------------------------------------------------------------
    // Status writes
    // ------------------------------------------------------------------

    /**
     * Validate and apply a status write on a managed Task. Re-asserting the
     * current status is a no-op.
     *
     * @return true if the status actually changed
     * @throws IllegalTransitionException if the move is not in the table
     */
    public boolean applyStatus(Task task, TaskStatus next) {
        validator.validate(task.getStatus(), next);
        return write(task, next);
    }

    /**
     * Status write for a MANUAL restart out of COMPLETED. The caller has
     * already confirmed it with {@link TransitionValidator#validateReentry}.
     */
    public void applyRestart(Task task, TaskStatus next) {
        write(task, next);
    }

    /** Workflow progress report, e.g. PROCESSING to TESTING. */
    @Transactional
    public Task updateStatus(UUID taskId, TaskStatus next) {
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (applyStatus(task, next)) {
            taskRepo.save(task);
        }
        return task;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<Run> getRuns(UUID taskId) {
        return runRepo.findByTaskIdOrderByCreatedAtAsc(taskId);
    }

    @Transactional(readOnly = true)
    public List<ReactivationAttempt> getAttempts(UUID taskId) {
        return attemptRepo.findByTaskIdOrderByReceivedAtAsc(taskId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean write(Task task, TaskStatus next) {
        TaskStatus from = task.getStatus();
        if (from == next) {
            return false;
        }
        task.recordStatusChange(next, clock.instant());
        if (next == TaskStatus.COMPLETED) {
            cooldownPolicy.reset(task);
        }
        log.info("Task {} {} -> {}", task.getId(), from, next);
        return true;
    }
}
