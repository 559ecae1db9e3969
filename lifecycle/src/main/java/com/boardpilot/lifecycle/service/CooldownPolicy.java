package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.config.ReactivationProperties;
import com.boardpilot.lifecycle.model.Task;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Backpressure on reactivation storms.
 *
 * Backoff grows as base * 2^(n-1) with the number of consecutive counted
 * rejections n, capped at max-backoff; n = 0 means no cooldown at all.
 * Once n reaches max-attempts the task is refused outright until it next
 * reaches COMPLETED.
 *
 * All methods mutate the passed Task in memory only. Persisting is the
 * caller's job, inside the same transaction as the decision.
 */
@Component
public class CooldownPolicy {

    private final ReactivationProperties props;

    public CooldownPolicy(ReactivationProperties props) {
        this.props = props;
    }

    /** Ceiling first, then the cooldown window. */
    public CooldownCheck check(Task task, Instant now) {
        if (task.getFailedReactivationAttempts() >= props.getMaxAttempts()) {
            return CooldownCheck.maxAttemptsExceeded();
        }
        Duration remaining = remaining(task, now);
        if (!remaining.isZero()) {
            return CooldownCheck.throttled(remaining);
        }
        return CooldownCheck.allowed();
    }

    public Duration remaining(Task task, Instant now) {
        Instant until = task.getCooldownUntil();
        if (until == null || !until.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, until);
    }

    public Duration backoff(int failedAttempts) {
        if (failedAttempts <= 0) {
            return Duration.ZERO;
        }
        int shift = failedAttempts - 1;
        // 2^30 * any sane base is already far past max-backoff
        if (shift >= 30) {
            return props.getMaxBackoff();
        }
        Duration scaled = props.getBaseBackoff().multipliedBy(1L << shift);
        return scaled.compareTo(props.getMaxBackoff()) > 0 ? props.getMaxBackoff() : scaled;
    }

    /** A counted rejection: one more strike and a cooldown that never moves backwards. */
    public void onRejected(Task task, Instant now) {
        int failed = task.getFailedReactivationAttempts() + 1;
        task.setFailedReactivationAttempts(failed);
        task.setLastReactivationAttempt(now);

        Instant candidate = now.plus(backoff(failed));
        Instant existing  = task.getCooldownUntil();
        task.setCooldownUntil(existing != null && existing.isAfter(candidate) ? existing : candidate);
    }

    public void onAccepted(Task task, Instant now) {
        task.setLastReactivationAttempt(now);
        Duration backoff = backoff(task.getFailedReactivationAttempts());
        task.setCooldownUntil(backoff.isZero() ? null : now.plus(backoff));
    }

    /** Reaching COMPLETED, or a manual restart out of it, wipes the slate. */
    public void reset(Task task) {
        task.setFailedReactivationAttempts(0);
        task.setCooldownUntil(null);
    }
}
