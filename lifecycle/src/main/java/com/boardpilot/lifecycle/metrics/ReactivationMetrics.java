package com.boardpilot.lifecycle.metrics;

import com.boardpilot.lifecycle.model.ReactivationAttempt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for the lifecycle controller. Exposed through the
 * actuator endpoints.
 */
@Service
public class ReactivationMetrics {

    private final MeterRegistry registry;

    public ReactivationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** One count and one timing per completed ledger entry. */
    public void recordDecision(ReactivationAttempt attempt) {
        String reason = attempt.getRejectionReason() == null
                ? "none"
                : attempt.getRejectionReason().name().toLowerCase();
        Counter.builder("boardpilot.reactivation.decisions")
                .description("Reactivation triggers by final decision")
                .tag("decision", attempt.getDecision().name().toLowerCase())
                .tag("reason", reason)
                .register(registry)
                .increment();

        if (attempt.getDurationMs() != null) {
            Timer.builder("boardpilot.reactivation.duration")
                    .description("Time from trigger receipt to ledger completion")
                    .tag("decision", attempt.getDecision().name().toLowerCase())
                    .register(registry)
                    .record(Duration.ofMillis(attempt.getDurationMs()));
        }
    }

    public void recordLocksSwept(int count) {
        if (count <= 0) return;
        Counter.builder("boardpilot.locks.swept")
                .description("Expired task locks force-cleared")
                .register(registry)
                .increment(count);
    }

    public void recordJobsRevoked(int count) {
        if (count <= 0) return;
        Counter.builder("boardpilot.jobs.revoked")
                .description("Executor jobs cancelled because newer work superseded them")
                .register(registry)
                .increment(count);
    }

    public void recordRunsRepaired(int count) {
        if (count <= 0) return;
        Counter.builder("boardpilot.runs.repaired")
                .description("Closed runs found still holding live job ids")
                .register(registry)
                .increment(count);
    }
}
