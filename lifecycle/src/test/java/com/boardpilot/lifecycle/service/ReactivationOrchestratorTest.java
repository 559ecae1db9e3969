package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.executor.ExecutorClient;
import com.boardpilot.lifecycle.executor.ExecutorException;
import com.boardpilot.lifecycle.metrics.ReactivationMetrics;
import com.boardpilot.lifecycle.model.*;
import com.boardpilot.lifecycle.repository.ReactivationAttemptRepository;
import com.boardpilot.lifecycle.repository.RunRepository;
import com.boardpilot.lifecycle.repository.TaskRepository;
import com.boardpilot.lifecycle.support.MutableClock;
import com.boardpilot.lifecycle.support.TestEntities;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReactivationOrchestrator.
 *
 * Collaborators are the real services; only the repositories and the
 * executor are mocked. The repositories are backed by in-memory maps and the
 * lock UPDATE by a compare-and-set flag, so a whole trigger sequence can be
 * replayed without a database.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReactivationOrchestratorTest {

    @Mock TaskRepository                taskRepo;
    @Mock RunRepository                 runRepo;
    @Mock ReactivationAttemptRepository attemptRepo;
    @Mock ExecutorClient                executorClient;
    @Mock PlatformTransactionManager    txManager;

    private final Map<UUID, ReactivationAttempt> attempts = new ConcurrentHashMap<>();
    private final List<Run>                      runs     = new CopyOnWriteArrayList<>();
    private final AtomicBoolean                  lockHeld = new AtomicBoolean(false);

    MutableClock             clock;
    SimpleMeterRegistry      registry;
    ReactivationOrchestrator orchestrator;
    Task                     task;

    @BeforeEach
    void setUp() {
        clock    = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        task     = TestEntities.task(TaskStatus.PENDING);

        ReactivationProperties props   = new ReactivationProperties();
        ReactivationMetrics    metrics = new ReactivationMetrics(registry);
        TransitionValidator    validator = new TransitionValidator();
        CooldownPolicy         cooldown  = new CooldownPolicy(props);
        TaskLifecycleService   lifecycle = new TaskLifecycleService(taskRepo, runRepo, attemptRepo, validator, cooldown, clock);
        LockManager            locks     = new LockManager(taskRepo, props, metrics, clock, txManager);
        ActiveJobTracker       tracker   = new ActiveJobTracker(runRepo, executorClient, lifecycle, metrics, clock);
        ReactivationLedger     ledger    = new ReactivationLedger(attemptRepo, clock);

        orchestrator = new ReactivationOrchestrator(lifecycle, locks, cooldown, validator, tracker, ledger,
                executorClient, taskRepo, runRepo, attemptRepo, metrics, clock, txManager);

        wireInMemoryRepositories();
        when(executorClient.submitJob(any(), any())).thenReturn("job-1", "job-2", "job-3", "job-4");
    }

    // ------------------------------------------------------------------
    // End-to-end scenarios
    // ------------------------------------------------------------------

    @Test
    void scenario_webhookThenDuplicateThenManual() {
        // Trigger 1: first webhook takes the task from PENDING to PROCESSING
        ReactivationAttempt first = submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);

        assertThat(first.getDecision()).isEqualTo(AttemptDecision.ACCEPTED);
        assertThat(first.getJobId()).isEqualTo("job-1");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getReactivationCount()).isEqualTo(1);
        assertThat(lockHeld).isFalse();
        assertThat(runs).hasSize(1);
        Run r1 = runs.get(0);
        assertThat(r1.getActiveJobIds()).containsExactly("job-1");

        // Trigger 2: duplicate webhook while another trigger holds the lock
        lockHeld.set(true);
        clock.advance(Duration.ofMillis(50));
        ReactivationAttempt duplicate = submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);
        lockHeld.set(false);

        assertThat(duplicate.getRejectionReason()).isEqualTo(RejectionReason.CONCURRENT_ATTEMPT);
        assertThat(duplicate.isCompleted()).isTrue();
        assertThat(task.getFailedReactivationAttempts()).isZero();   // not counted

        // Trigger 3: manual, same status -> idempotent accept that supersedes job-1
        clock.advance(Duration.ofSeconds(1));
        ReactivationAttempt manual = submit(TriggerType.MANUAL, TaskStatus.PROCESSING);

        assertThat(manual.getDecision()).isEqualTo(AttemptDecision.ACCEPTED);
        assertThat(manual.getPreviousJobsRevoked()).isEqualTo(1);
        assertThat(manual.getRunId()).isEqualTo(r1.getId());
        verify(executorClient).cancelJob("job-1");
        assertThat(r1.getActiveJobIds()).containsExactly("job-2");
        assertThat(runs).hasSize(1);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getReactivationCount()).isEqualTo(2);
        assertThat(lockHeld).isFalse();
    }

    @Test
    void scenario_repeatedFailuresHitCeilingBeforeCooldown() {
        Instant previousCooldown = null;
        for (int n = 1; n <= 5; n++) {
            // PENDING -> TESTING is not in the table
            ReactivationAttempt a = submit(TriggerType.UPDATE, TaskStatus.TESTING);

            assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.ILLEGAL_TRANSITION);
            assertThat(task.getFailedReactivationAttempts()).isEqualTo(n);
            if (previousCooldown != null) {
                assertThat(task.getCooldownUntil()).isAfter(previousCooldown);
            }
            previousCooldown = task.getCooldownUntil();

            // wait the cooldown out before the next attempt
            clock.advance(Duration.between(clock.instant(), task.getCooldownUntil()).plusSeconds(1));
        }

        ReactivationAttempt sixth = submit(TriggerType.UPDATE, TaskStatus.PROCESSING);

        assertThat(sixth.getRejectionReason()).isEqualTo(RejectionReason.MAX_REACTIVATIONS_EXCEEDED);
        assertThat(task.getFailedReactivationAttempts()).isEqualTo(5);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        verify(executorClient, never()).submitJob(any(), any());
    }

    @Test
    void scenario_manualRestartOfCompletedTask_resetsAttemptBudget() {
        task.recordStatusChange(TaskStatus.COMPLETED, clock.instant());
        task.setFailedReactivationAttempts(3);

        ReactivationAttempt a = submit(TriggerType.MANUAL, TaskStatus.PROCESSING);

        assertThat(a.getDecision()).isEqualTo(AttemptDecision.ACCEPTED);
        assertThat(task.getFailedReactivationAttempts()).isZero();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getPreviousStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(runs.get(0).isReactivation()).isTrue();
    }

    // ------------------------------------------------------------------
    // Individual rejection reasons
    // ------------------------------------------------------------------

    @Test
    void completedTask_automaticTrigger_isIllegalTransition() {
        task.recordStatusChange(TaskStatus.COMPLETED, clock.instant());

        ReactivationAttempt a = submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);

        assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.ILLEGAL_TRANSITION);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getFailedReactivationAttempts()).isEqualTo(1);
    }

    @Test
    void completedTask_triggerAskingForCompleted_isIllegalAndSubmitsNothing() {
        task.recordStatusChange(TaskStatus.COMPLETED, clock.instant());

        ReactivationAttempt a = submit(TriggerType.API, TaskStatus.COMPLETED);

        assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.ILLEGAL_TRANSITION);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getReactivationCount()).isZero();
        assertThat(runs).isEmpty();
        verify(executorClient, never()).submitJob(any(), any());
    }

    @Test
    void runningTask_webhookAskingForCompleted_isIllegalAndKeepsJob() {
        submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);
        clock.advance(Duration.ofSeconds(1));

        ReactivationAttempt a = submit(TriggerType.WEBHOOK, TaskStatus.COMPLETED);

        assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.ILLEGAL_TRANSITION);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getReactivationCount()).isEqualTo(1);
        assertThat(runs.get(0).getActiveJobIds()).containsExactly("job-1");
        verify(executorClient, times(1)).submitJob(any(), any());
        verify(executorClient, never()).cancelJob(any());
    }

    @Test
    void insideCooldown_isThrottledAndWindowGrows() {
        task.setFailedReactivationAttempts(1);
        task.setLastReactivationAttempt(clock.instant());
        task.setCooldownUntil(clock.instant().plusSeconds(30));

        ReactivationAttempt a = submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);

        assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.THROTTLED);
        assertThat(a.getCooldownRemainingMs()).isEqualTo(30_000L);
        assertThat(task.getFailedReactivationAttempts()).isEqualTo(2);
        assertThat(task.getCooldownUntil()).isEqualTo(clock.instant().plusSeconds(60));
        verify(executorClient, never()).submitJob(any(), any());
    }

    @Test
    void retryWhileJobIsLive_isAlreadyActive() {
        submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);

        ReactivationAttempt retry = submit(TriggerType.RETRY, TaskStatus.PROCESSING);

        assertThat(retry.getRejectionReason()).isEqualTo(RejectionReason.ALREADY_ACTIVE);
        assertThat(runs.get(0).getActiveJobIds()).containsExactly("job-1");
        verify(executorClient, never()).cancelJob(anyString());
        verify(executorClient, times(1)).submitJob(any(), any());
    }

    @Test
    void retryAfterJobFinished_isAccepted() {
        submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);
        runs.get(0).removeJob("job-1", "failed");

        ReactivationAttempt retry = submit(TriggerType.RETRY, TaskStatus.PROCESSING);

        assertThat(retry.getDecision()).isEqualTo(AttemptDecision.ACCEPTED);
        assertThat(retry.getPreviousJobsRevoked()).isZero();
    }

    // ------------------------------------------------------------------
    // Job dedup and failures
    // ------------------------------------------------------------------

    @Test
    void supersedingTrigger_cancelsEveryLiveJobBeforeRegisteringNewOne() {
        submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);
        Run run = runs.get(0);
        run.addJob("stray-job", clock.instant());   // duplicate submission left over

        ReactivationAttempt update = submit(TriggerType.UPDATE, TaskStatus.PROCESSING);

        var inOrder = inOrder(executorClient);
        inOrder.verify(executorClient).cancelJob("job-1");
        inOrder.verify(executorClient).cancelJob("stray-job");
        inOrder.verify(executorClient).submitJob(eq(run.getId()), any());
        assertThat(update.getPreviousJobsRevoked()).isEqualTo(2);
        assertThat(run.getActiveJobIds()).containsExactly("job-2");
    }

    @Test
    void executorFailure_isInternalErrorAndLockReleased() {
        when(executorClient.submitJob(any(), any())).thenThrow(new ExecutorException("connection refused"));

        ReactivationAttempt a = submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);

        assertThat(a.getRejectionReason()).isEqualTo(RejectionReason.INTERNAL_ERROR);
        assertThat(a.getErrorMessage()).contains("connection refused");
        assertThat(a.isCompleted()).isTrue();
        assertThat(lockHeld).isFalse();
        verify(txManager).rollback(any());
    }

    @Test
    void unknownTaskId_throwsAndWritesNoLedgerEntry() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> orchestrator.submit(TriggerRequest.forTask(unknown, TriggerType.API, "api")))
                .isInstanceOf(TaskNotFoundException.class);
        assertThat(attempts).isEmpty();
    }

    @Test
    void everyTrigger_recordsOneDecisionMetric() {
        submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING);
        submit(TriggerType.RETRY, TaskStatus.PROCESSING);

        assertThat(registry.get("boardpilot.reactivation.decisions")
                .tag("decision", "accepted").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("boardpilot.reactivation.decisions")
                .tag("reason", "already_active").counter().count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Mutual exclusion
    // ------------------------------------------------------------------

    @Test
    void concurrentTriggers_onlyOneAccepted() throws Exception {
        CountDownLatch submitting = new CountDownLatch(1);
        CountDownLatch proceed    = new CountDownLatch(1);
        when(executorClient.submitJob(any(), any())).thenAnswer(inv -> {
            submitting.countDown();
            proceed.await(5, TimeUnit.SECONDS);
            return "job-slow";
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<ReactivationAttempt> first = pool.submit(() -> submit(TriggerType.WEBHOOK, TaskStatus.PROCESSING));
        assertThat(submitting.await(5, TimeUnit.SECONDS)).isTrue();

        // first trigger is mid-decision and holds the lock
        ReactivationAttempt second = submit(TriggerType.MANUAL, TaskStatus.PROCESSING);
        proceed.countDown();
        ReactivationAttempt firstResult = first.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(firstResult.getDecision()).isEqualTo(AttemptDecision.ACCEPTED);
        assertThat(second.getRejectionReason()).isEqualTo(RejectionReason.CONCURRENT_ATTEMPT);
        assertThat(lockHeld).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ReactivationAttempt submit(TriggerType type, TaskStatus requested) {
        return orchestrator.submit(new TriggerRequest(task.getId(), null, null, type,
                "test", "{\"item\":42}", requested, null));
    }

    private void wireInMemoryRepositories() {
        when(taskRepo.findById(any())).thenAnswer(inv ->
                task.getId().equals(inv.getArgument(0)) ? Optional.of(task) : Optional.empty());
        when(taskRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(taskRepo.tryAcquireLock(any(), anyString(), any(), any()))
                .thenAnswer(inv -> lockHeld.compareAndSet(false, true) ? 1 : 0);
        when(taskRepo.releaseLock(any(), anyString()))
                .thenAnswer(inv -> lockHeld.compareAndSet(true, false) ? 1 : 0);

        when(attemptRepo.save(any())).thenAnswer(inv -> {
            ReactivationAttempt a = inv.getArgument(0);
            if (a.getId() == null) TestEntities.withId(a);
            attempts.put(a.getId(), a);
            return a;
        });
        when(attemptRepo.findById(any())).thenAnswer(inv -> Optional.ofNullable(attempts.get(inv.getArgument(0))));

        when(runRepo.save(any())).thenAnswer(inv -> {
            Run r = inv.getArgument(0);
            if (r.getId() == null) TestEntities.withId(r);
            if (!runs.contains(r)) runs.add(r);
            return r;
        });
        when(runRepo.findFirstByTaskIdAndStatusOrderByCreatedAtDesc(any(), eq(RunStatus.ACTIVE)))
                .thenAnswer(inv -> runs.stream()
                        .filter(r -> r.getTask().getId().equals(inv.getArgument(0)))
                        .filter(r -> r.getStatus() == RunStatus.ACTIVE)
                        .reduce((a, b) -> b));
    }
}
