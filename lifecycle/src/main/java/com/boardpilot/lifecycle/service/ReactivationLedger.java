package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.model.ReactivationAttempt;
import com.boardpilot.lifecycle.model.RejectionReason;
import com.boardpilot.lifecycle.repository.ReactivationAttemptRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes to the reactivation_attempts ledger.
 *
 * Opening an entry and the two early-exit completions (lock busy, internal
 * error) commit in their own transactions, so the ledger row survives a
 * rollback of the decision. The normal completion is done by the
 * orchestrator inside the decision transaction itself.
 */
@Service
public class ReactivationLedger {

    private final ReactivationAttemptRepository attemptRepo;
    private final Clock                         clock;

    public ReactivationLedger(ReactivationAttemptRepository attemptRepo, Clock clock) {
        this.attemptRepo = attemptRepo;
        this.clock       = clock;
    }

    /** Received: insert the PENDING entry. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReactivationAttempt open(UUID taskId, TriggerRequest req) {
        return attemptRepo.save(new ReactivationAttempt(
                taskId,
                req.triggerType(),
                req.triggerSource(),
                req.payload(),
                req.requestedStatus(),
                req.confidenceScore(),
                clock.instant()));
    }

    /** Reject and complete an entry without touching the task. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReactivationAttempt reject(UUID attemptId, RejectionReason reason, String message) {
        ReactivationAttempt attempt = load(attemptId);
        attempt.reject(reason, message, null, clock.instant());
        attempt.complete(clock.instant());
        return attemptRepo.save(attempt);
    }

    /** Record an unexpected fault as INTERNAL_ERROR and complete the entry. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReactivationAttempt fail(UUID attemptId, Throwable error) {
        ReactivationAttempt attempt = load(attemptId);
        attempt.fail(describe(error), clock.instant());
        attempt.complete(clock.instant());
        return attemptRepo.save(attempt);
    }

    private ReactivationAttempt load(UUID attemptId) {
        return attemptRepo.findById(attemptId).orElseThrow(() ->
                new IllegalStateException("Ledger entry vanished: " + attemptId));
    }

    private static String describe(Throwable error) {
        String msg = error.getMessage();
        return msg == null ? error.getClass().getName() : error.getClass().getSimpleName() + ": " + msg;
    }
}
