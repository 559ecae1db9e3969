package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.service.ActiveJobTracker;
import com.boardpilot.lifecycle.service.LockManager;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Operator actions. These run the same code as the background janitor,
 * on demand.
 *
 * POST /admin/locks/sweep        - clear locks older than lock-ttl (or ?maxAgeMinutes=N)
 * POST /admin/locks/release-all  - clear every lock; use after a full outage
 * POST /admin/runs/reconcile     - repair closed runs still holding live jobs
 */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final LockManager      lockManager;
    private final ActiveJobTracker tracker;

    public AdminController(LockManager lockManager, ActiveJobTracker tracker) {
        this.lockManager = lockManager;
        this.tracker     = tracker;
    }

    @PostMapping("/locks/sweep")
    public Map<String, Integer> sweepLocks(@RequestParam(required = false) Integer maxAgeMinutes) {
        int cleared = maxAgeMinutes == null
                ? lockManager.sweepExpired()
                : lockManager.sweepExpired(Duration.ofMinutes(maxAgeMinutes));
        return Map.of("cleared", cleared);
    }

    @PostMapping("/locks/release-all")
    public Map<String, Integer> releaseAllLocks() {
        return Map.of("cleared", lockManager.forceReleaseAll());
    }

    @PostMapping("/runs/reconcile")
    public Map<String, Integer> reconcileRuns() {
        return Map.of("repaired", tracker.reconcileClosedRuns());
    }
}
