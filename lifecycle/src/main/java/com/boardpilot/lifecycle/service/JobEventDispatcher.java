package com.boardpilot.lifecycle.service;

import com.boardpilot.lifecycle.logging.MdcContext;
import com.boardpilot.lifecycle.model.JobEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Queues executor callbacks and applies them off the HTTP thread.
 *
 * Events are striped over single-thread lanes by run id: all events of one
 * run go through the same lane in arrival order, different runs proceed in
 * parallel. A write that loses an optimistic-lock race (e.g. against a
 * trigger decision on the same task) is retried a few times.
 */
@Component
public class JobEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobEventDispatcher.class);

    static final int MAX_ATTEMPTS = 3;

    private final ActiveJobTracker      tracker;
    private final List<ExecutorService> lanes;

    public JobEventDispatcher(ActiveJobTracker tracker,
                              @Value("${boardpilot.executor.event-lanes:4}") int laneCount) {
        this.tracker = tracker;
        this.lanes   = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            lanes.add(Executors.newSingleThreadExecutor());
        }
    }

    public void dispatch(UUID runId, String jobId, JobEvent event) {
        ExecutorService lane = lanes.get(Math.floorMod(runId.hashCode(), lanes.size()));
        lane.submit(() -> handle(runId, jobId, event));
    }

    /** Apply one event on the calling thread. */
    void handle(UUID runId, String jobId, JobEvent event) {
        MdcContext.putRun(runId);
        try {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    tracker.onJobEvent(runId, jobId, event);
                    return;
                } catch (OptimisticLockingFailureException e) {
                    log.warn("Event {} for job '{}' lost a concurrent update (attempt {}/{})",
                            event, jobId, attempt, MAX_ATTEMPTS);
                }
            }
            log.error("Event {} for job '{}' on run {} dropped after {} conflicting attempts; "
                    + "the run audit will pick up any inconsistency", event, jobId, runId, MAX_ATTEMPTS);
        } catch (RuntimeException e) {
            log.error("Unhandled error applying event {} for job '{}' on run {}: {}",
                    event, jobId, runId, e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        for (ExecutorService lane : lanes) {
            if (!lane.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Event lane did not drain within 10s, dropping queued events");
                lane.shutdownNow();
            }
        }
    }
}
