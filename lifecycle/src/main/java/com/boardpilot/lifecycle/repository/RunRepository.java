package com.boardpilot.lifecycle.repository;

import com.boardpilot.lifecycle.model.Run;
import com.boardpilot.lifecycle.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + tracker queries for the task_runs table.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /** The run new work is attached to, if the task has one open. */
    Optional<Run> findFirstByTaskIdAndStatusOrderByCreatedAtDesc(UUID taskId, RunStatus status);

    List<Run> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    /** Runs with at least one job id the executor is believed to be working on. */
    @Query("SELECT DISTINCT r FROM Run r JOIN r.activeJobIds j ORDER BY r.createdAt ASC")
    List<Run> findWithLiveJobs();

    /**
     * Closed runs that still list live jobs. Always empty when the tracker is
     * consistent; the periodic audit repairs whatever this returns.
     */
    @Query("SELECT DISTINCT r FROM Run r JOIN r.activeJobIds j WHERE r.status <> :active")
    List<Run> findClosedWithLiveJobs(@Param("active") RunStatus active);
}
