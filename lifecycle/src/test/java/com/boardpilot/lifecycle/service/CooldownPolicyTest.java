package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.model.Task;
import com.boardpilot.lifecycle.model.TaskStatus;
import com.boardpilot.lifecycle.support.TestEntities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownPolicyTest {

    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");

    private ReactivationProperties props;
    private CooldownPolicy         policy;

    @BeforeEach
    void setUp() {
        props  = new ReactivationProperties();   // 5 attempts, 30s base, 15m cap
        policy = new CooldownPolicy(props);
    }

    // ------------------------------------------------------------------
    // backoff()
    // ------------------------------------------------------------------

    @Test
    void backoff_doublesFromBaseAndCaps() {
        assertThat(policy.backoff(0)).isEqualTo(Duration.ZERO);
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofMinutes(8));
        assertThat(policy.backoff(6)).isEqualTo(Duration.ofMinutes(15));   // 16m, capped
        assertThat(policy.backoff(64)).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void backoff_isNonDecreasing() {
        Duration previous = Duration.ZERO;
        for (int n = 0; n <= 40; n++) {
            Duration d = policy.backoff(n);
            assertThat(d).isGreaterThanOrEqualTo(previous);
            previous = d;
        }
    }

    // ------------------------------------------------------------------
    // check()
    // ------------------------------------------------------------------

    @Test
    void check_freshTask_isAllowed() {
        assertThat(policy.check(TestEntities.task(TaskStatus.PENDING), now).isAllowed()).isTrue();
    }

    @Test
    void check_insideWindow_isThrottledWithRemaining() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        task.setCooldownUntil(now.plusSeconds(45));

        CooldownCheck check = policy.check(task, now);

        assertThat(check.outcome()).isEqualTo(CooldownCheck.Outcome.THROTTLED);
        assertThat(check.remaining()).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void check_ceilingWinsOverCooldown() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        task.setFailedReactivationAttempts(5);
        task.setCooldownUntil(now.plusSeconds(45));

        assertThat(policy.check(task, now).outcome())
                .isEqualTo(CooldownCheck.Outcome.MAX_ATTEMPTS_EXCEEDED);
    }

    @Test
    void check_windowEndingNow_isAllowed() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        task.setCooldownUntil(now);

        assertThat(policy.check(task, now).isAllowed()).isTrue();
    }

    // ------------------------------------------------------------------
    // onRejected() / onAccepted() / reset()
    // ------------------------------------------------------------------

    @Test
    void onRejected_countsAndCooldownNeverMovesBack() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        Instant previous = null;
        for (int n = 1; n <= 5; n++) {
            policy.onRejected(task, now.plusSeconds(n));
            assertThat(task.getFailedReactivationAttempts()).isEqualTo(n);
            if (previous != null) {
                assertThat(task.getCooldownUntil()).isAfterOrEqualTo(previous);
            }
            previous = task.getCooldownUntil();
        }
    }

    @Test
    void onRejected_keepsLongerExistingWindow() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        Instant far = now.plus(Duration.ofHours(1));
        task.setCooldownUntil(far);

        policy.onRejected(task, now);

        assertThat(task.getCooldownUntil()).isEqualTo(far);
        assertThat(task.getLastReactivationAttempt()).isEqualTo(now);
    }

    @Test
    void onAccepted_withoutFailures_leavesNoWindow() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);

        policy.onAccepted(task, now);

        assertThat(task.getCooldownUntil()).isNull();
        assertThat(task.getLastReactivationAttempt()).isEqualTo(now);
    }

    @Test
    void onAccepted_afterFailures_opensBackoffWindow() {
        Task task = TestEntities.task(TaskStatus.PROCESSING);
        task.setFailedReactivationAttempts(2);

        policy.onAccepted(task, now);

        assertThat(task.getCooldownUntil()).isEqualTo(now.plusSeconds(60));
    }

    @Test
    void reset_clearsCounterAndWindow() {
        Task task = TestEntities.task(TaskStatus.COMPLETED);
        task.setFailedReactivationAttempts(3);
        task.setCooldownUntil(now.plusSeconds(100));

        policy.reset(task);

        assertThat(task.getFailedReactivationAttempts()).isZero();
        assertThat(task.getCooldownUntil()).isNull();
    }
}
