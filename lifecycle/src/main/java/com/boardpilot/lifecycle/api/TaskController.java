package com.boardpilot.lifecycle.api;

import com.boardpilot.lifecycle.api.dto.*;
import com.boardpilot.lifecycle.service.MonitoringService;
import com.boardpilot.lifecycle.service.MonitoringService.CooldownInfo;
import com.boardpilot.lifecycle.service.MonitoringService.TaskReactivationStats;
import com.boardpilot.lifecycle.service.TaskLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for tasks.
 *
 * POST /tasks                 - register a task
 * GET  /tasks/{id}            - current status, counters and lock holder
 * PUT  /tasks/{id}/status     - workflow progress report (validated, 409 if illegal)
 * GET  /tasks/{id}/runs       - execution history
 * GET  /tasks/{id}/attempts   - reactivation ledger for the task
 * GET  /tasks/{id}/cooldown   - current cooldown window and next backoff
 * GET  /tasks/{id}/stats      - ledger aggregates for the task
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskLifecycleService lifecycle;
    private final MonitoringService    monitoring;

    public TaskController(TaskLifecycleService lifecycle, MonitoringService monitoring) {
        this.lifecycle  = lifecycle;
        this.monitoring = monitoring;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> register(@RequestBody RegisterTaskRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TaskResponse.from(lifecycle.register(req.externalId(), req.title())));
    }

    @GetMapping("/{id}")
    public TaskResponse getTask(@PathVariable UUID id) {
        return lifecycle.findById(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @PutMapping("/{id}/status")
    public TaskResponse updateStatus(@PathVariable UUID id, @RequestBody StatusUpdateRequest req) {
        if (req.status() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        return TaskResponse.from(lifecycle.updateStatus(id, req.status()));
    }

    @GetMapping("/{id}/runs")
    public List<RunResponse> getRuns(@PathVariable UUID id) {
        lifecycle.findById(id).orElseThrow(() -> notFound(id));
        return lifecycle.getRuns(id).stream()
                .map(RunResponse::from)
                .toList();
    }

    @GetMapping("/{id}/attempts")
    public List<AttemptResponse> getAttempts(@PathVariable UUID id) {
        lifecycle.findById(id).orElseThrow(() -> notFound(id));
        return lifecycle.getAttempts(id).stream()
                .map(AttemptResponse::from)
                .toList();
    }

    @GetMapping("/{id}/cooldown")
    public CooldownInfo getCooldown(@PathVariable UUID id) {
        return monitoring.cooldown(id);
    }

    @GetMapping("/{id}/stats")
    public TaskReactivationStats getStats(@PathVariable UUID id) {
        return monitoring.taskStats(id);
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + id);
    }
}
