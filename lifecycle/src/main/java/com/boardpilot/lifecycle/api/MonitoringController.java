package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.api.dto.AttemptResponse;
import com.boardpilot.lifecycle.service.MonitoringService;
import com.boardpilot.lifecycle.service.MonitoringService.ActiveJobView;
import com.boardpilot.lifecycle.service.MonitoringService.CooldownInfo;
import com.boardpilot.lifecycle.service.MonitoringService.ReactivableTaskView;
import com.boardpilot.lifecycle.service.MonitoringService.ReactivationStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only dashboard queries.
 *
 * GET /monitoring/reactivable-tasks  - every task with its availability (?onlyReactivable=true to filter)
 * GET /monitoring/active-jobs        - runs holding live executor jobs
 * GET /monitoring/stats              - task and ledger aggregates
 * GET /monitoring/recent-attempts    - ledger entries of the last 24 hours
 * GET /monitoring/cooldowns          - tasks currently in a cooldown window
 */
@RestController
@RequestMapping("/monitoring")
public class MonitoringController {

    private final MonitoringService monitoring;

    public MonitoringController(MonitoringService monitoring) {
        this.monitoring = monitoring;
    }

    @GetMapping("/reactivable-tasks")
    public List<ReactivableTaskView> reactivableTasks(
            @RequestParam(defaultValue = "false") boolean onlyReactivable) {
        return monitoring.reactivableTasks(onlyReactivable);
    }

    @GetMapping("/active-jobs")
    public List<ActiveJobView> activeJobs() {
        return monitoring.activeJobs();
    }

    @GetMapping("/stats")
    public ReactivationStats stats() {
        return monitoring.stats();
    }

    @GetMapping("/recent-attempts")
    public List<AttemptResponse> recentAttempts() {
        return monitoring.recentAttempts().stream()
                .map(AttemptResponse::from)
                .toList();
    }

    @GetMapping("/cooldowns")
    public List<CooldownInfo> cooldowns() {
        return monitoring.tasksInCooldown();
    }
}
