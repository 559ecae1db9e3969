package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.model.*;
import com.boardpilot.lifecycle.repository.ReactivationAttemptRepository;
import com.boardpilot.lifecycle.repository.RunRepository;
import com.boardpilot.lifecycle.repository.TaskRepository;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only projections of tasks, runs and the ledger for dashboards and
 * operators. Nothing here writes; every method runs in a read-only
 * transaction and recomputes from the tables.
 */
@Service
@Transactional(readOnly = true)
public class MonitoringService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final TaskRepository                taskRepo;
    private final RunRepository                 runRepo;
    private final ReactivationAttemptRepository attemptRepo;
    private final CooldownPolicy                cooldownPolicy;
    private final ReactivationProperties        props;
    private final Clock                         clock;

    public MonitoringService(TaskRepository taskRepo,
                             RunRepository runRepo,
                             ReactivationAttemptRepository attemptRepo,
                             CooldownPolicy cooldownPolicy,
                             ReactivationProperties props,
                             Clock clock) {
        this.taskRepo       = taskRepo;
        this.runRepo        = runRepo;
        this.attemptRepo    = attemptRepo;
        this.cooldownPolicy = cooldownPolicy;
        this.props          = props;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // View types
    // ------------------------------------------------------------------

    /**
     * Why a task would or would not accept a trigger right now. First match wins.
     * TERMINAL tasks take nothing but a MANUAL restart.
     */
    public enum Availability { LOCKED, TERMINAL, MAX_ATTEMPTS, COOLDOWN, ALREADY_ACTIVE, REACTIVABLE }

    public record ReactivableTaskView(
            UUID         taskId,
            String       externalId,
            String       title,
            TaskStatus   status,
            Availability availability,
            long         cooldownRemainingSeconds,
            int          failedReactivationAttempts,
            int          reactivationCount,
            String       lockedBy,
            Instant      lockedAt,
            Instant      lastReactivationAttempt
    ) {}

    public record ActiveJobView(
            UUID        runId,
            UUID        taskId,
            String      externalId,
            TaskStatus  taskStatus,
            Set<String> jobIds,
            boolean     duplicate,
            Instant     jobStartedAt,
            long        runningSeconds,
            boolean     reactivation,
            int         reactivationNumber
    ) {}

    public record ReactivationStats(
            long                totalTasks,
            long                lockedTasks,
            long                tasksInCooldown,
            long                tasksWithFailedAttempts,
            long                tasksAtAttemptCeiling,
            long                reactivatedTasks,
            double              averageReactivations,
            int                 maxReactivations,
            long                attemptsAccepted,
            long                attemptsRejected,
            Map<String, Long>   rejectionsByReason,
            double              averageDecisionMs
    ) {}

    public record TaskReactivationStats(
            UUID        taskId,
            long        totalAttempts,
            long        accepted,
            long        rejected,
            double      successRate,
            double      averageDecisionMs,
            Instant     lastAttemptAt,
            TriggerType mostCommonTrigger
    ) {}

    public record CooldownInfo(
            UUID    taskId,
            boolean inCooldown,
            Instant cooldownUntil,
            long    remainingSeconds,
            int     failedReactivationAttempts,
            int     maxAttempts,
            long    nextBackoffSeconds,
            Instant lastReactivationAttempt
    ) {}

    // ------------------------------------------------------------------
    // Task views
    // ------------------------------------------------------------------

    /**
     * Every task with its availability classification.
     *
     * @param onlyReactivable keep just the tasks a trigger would get past the
     *                        lock, cooldown and live-job checks right now
     */
    public List<ReactivableTaskView> reactivableTasks(boolean onlyReactivable) {
        Instant now = clock.instant();
        Set<UUID> busyTasks = runRepo.findWithLiveJobs().stream()
                .map(r -> r.getTask().getId())
                .collect(Collectors.toSet());

        return taskRepo.findAll(Sort.by(Sort.Direction.DESC, "updatedAt")).stream()
                .map(t -> toView(t, classify(t, busyTasks.contains(t.getId()), now), now))
                .filter(v -> !onlyReactivable || v.availability() == Availability.REACTIVABLE)
                .toList();
    }

    public List<ActiveJobView> activeJobs() {
        Instant now = clock.instant();
        return runRepo.findWithLiveJobs().stream()
                .map(r -> new ActiveJobView(
                        r.getId(),
                        r.getTask().getId(),
                        r.getTask().getExternalId(),
                        r.getTask().getStatus(),
                        new LinkedHashSet<>(r.getActiveJobIds()),
                        r.getActiveJobIds().size() > 1,
                        r.getJobStartedAt(),
                        r.getJobStartedAt() == null ? 0 : Duration.between(r.getJobStartedAt(), now).toSeconds(),
                        r.isReactivation(),
                        r.getReactivationNumber()))
                .toList();
    }

    public List<CooldownInfo> tasksInCooldown() {
        Instant now = clock.instant();
        return taskRepo.findByCooldownUntilAfterOrderByCooldownUntilAsc(now).stream()
                .map(t -> cooldownInfo(t, now))
                .toList();
    }

    public CooldownInfo cooldown(UUID taskId) {
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        return cooldownInfo(task, clock.instant());
    }

    // ------------------------------------------------------------------
    // Aggregates
    // ------------------------------------------------------------------

    public ReactivationStats stats() {
        Instant now = clock.instant();

        Map<String, Long> byReason = new TreeMap<>();
        for (Object[] row : attemptRepo.countByReason(AttemptDecision.REJECTED)) {
            if (row[0] != null) {
                byReason.put(((RejectionReason) row[0]).name(), ((Number) row[1]).longValue());
            }
        }
        Double  avgReactivations = taskRepo.averageReactivationCount();
        Integer maxReactivations = taskRepo.maxReactivationCount();
        Double  avgDecision      = attemptRepo.averageDurationMs();

        return new ReactivationStats(
                taskRepo.count(),
                taskRepo.countByLockedTrue(),
                taskRepo.countByCooldownUntilAfter(now),
                taskRepo.countByFailedReactivationAttemptsGreaterThan(0),
                taskRepo.countByFailedReactivationAttemptsGreaterThanEqual(props.getMaxAttempts()),
                taskRepo.countByReactivationCountGreaterThan(0),
                avgReactivations == null ? 0.0 : avgReactivations,
                maxReactivations == null ? 0 : maxReactivations,
                attemptRepo.countByDecision(AttemptDecision.ACCEPTED),
                attemptRepo.countByDecision(AttemptDecision.REJECTED),
                byReason,
                avgDecision == null ? 0.0 : avgDecision);
    }

    public TaskReactivationStats taskStats(UUID taskId) {
        if (!taskRepo.existsById(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        long total    = attemptRepo.countByTaskId(taskId);
        long accepted = attemptRepo.countByTaskIdAndDecision(taskId, AttemptDecision.ACCEPTED);
        long rejected = attemptRepo.countByTaskIdAndDecision(taskId, AttemptDecision.REJECTED);
        Double avg    = attemptRepo.averageDurationMs(taskId);

        List<Object[]> triggers = attemptRepo.triggerTypeFrequency(taskId);
        TriggerType mostCommon = triggers.isEmpty() ? null : (TriggerType) triggers.get(0)[0];

        return new TaskReactivationStats(
                taskId,
                total,
                accepted,
                rejected,
                total == 0 ? 0.0 : Math.round(accepted * 10000.0 / total) / 100.0,
                avg == null ? 0.0 : avg,
                attemptRepo.lastReceivedAt(taskId),
                mostCommon);
    }

    public List<ReactivationAttempt> recentAttempts() {
        return attemptRepo.findByReceivedAtAfterOrderByReceivedAtDesc(clock.instant().minus(RECENT_WINDOW));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    Availability classify(Task task, boolean hasLiveJobs, Instant now) {
        if (task.isLocked() && task.getLockedAt() != null
                && task.getLockedAt().isAfter(now.minus(props.getLockTtl()))) {
            return Availability.LOCKED;
        }
        if (task.getStatus().isTerminal()) {
            return Availability.TERMINAL;
        }
        CooldownCheck check = cooldownPolicy.check(task, now);
        if (check.outcome() == CooldownCheck.Outcome.MAX_ATTEMPTS_EXCEEDED) {
            return Availability.MAX_ATTEMPTS;
        }
        if (check.outcome() == CooldownCheck.Outcome.THROTTLED) {
            return Availability.COOLDOWN;
        }
        if (hasLiveJobs) {
            return Availability.ALREADY_ACTIVE;
        }
        return Availability.REACTIVABLE;
    }

    private ReactivableTaskView toView(Task t, Availability availability, Instant now) {
        return new ReactivableTaskView(
                t.getId(),
                t.getExternalId(),
                t.getTitle(),
                t.getStatus(),
                availability,
                cooldownPolicy.remaining(t, now).toSeconds(),
                t.getFailedReactivationAttempts(),
                t.getReactivationCount(),
                t.getLockedBy(),
                t.getLockedAt(),
                t.getLastReactivationAttempt());
    }

    private CooldownInfo cooldownInfo(Task t, Instant now) {
        Duration remaining = cooldownPolicy.remaining(t, now);
        return new CooldownInfo(
                t.getId(),
                !remaining.isZero(),
                t.getCooldownUntil(),
                remaining.toSeconds(),
                t.getFailedReactivationAttempts(),
                props.getMaxAttempts(),
                cooldownPolicy.backoff(t.getFailedReactivationAttempts() + 1).toSeconds(),
                t.getLastReactivationAttempt());
    }
}
