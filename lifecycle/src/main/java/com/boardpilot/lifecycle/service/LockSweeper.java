package com.boardpilot.lifecycle.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background janitor.
 *
 * Two independent fixed-delay jobs on Spring's scheduler thread, never on a
 * request thread:
 *   - clear task locks whose owner has held them past lock-ttl (crashed owner)
 *   - audit closed runs that still list live jobs
 *
 * Both share only the atomic primitives of LockManager and ActiveJobTracker
 * with the request path, so they are safe to run at any moment.
 */
@Component
@EnableScheduling
public class LockSweeper {

    private static final Logger log = LoggerFactory.getLogger(LockSweeper.class);

    private final LockManager      lockManager;
    private final ActiveJobTracker tracker;

    public LockSweeper(LockManager lockManager, ActiveJobTracker tracker) {
        this.lockManager = lockManager;
        this.tracker     = tracker;
    }

    @Scheduled(fixedDelayString = "${boardpilot.sweeper.lock-interval:PT1M}",
               initialDelayString = "${boardpilot.sweeper.initial-delay:PT30S}")
    public void sweepLocks() {
        try {
            lockManager.sweepExpired();
        } catch (RuntimeException e) {
            log.error("Lock sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${boardpilot.sweeper.audit-interval:PT10M}",
               initialDelayString = "${boardpilot.sweeper.initial-delay:PT30S}")
    public void auditRuns() {
        try {
            int repaired = tracker.reconcileClosedRuns();
            if (repaired > 0) {
                log.warn("Run audit repaired {} closed run(s) holding live jobs", repaired);
            }
        } catch (RuntimeException e) {
            log.error("Run audit failed: {}", e.getMessage(), e);
        }
    }
}
