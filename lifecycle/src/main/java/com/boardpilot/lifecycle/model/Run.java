package com.boardpilot.lifecycle.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One execution attempt of a Task.
 *
 * A run stays ACTIVE across reactivations that supersede its jobs: the old
 * job ids are revoked and the new one is registered on the same run. Once
 * closed, a run never holds live job ids again.
 *
 * DB tables: task_runs, run_active_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_runs")
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.ACTIVE;

    // Executor job ids believed live. More than one means a duplicate submission.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "run_active_jobs", joinColumns = @JoinColumn(name = "run_id"))
    @Column(name = "job_id", nullable = false)
    private Set<String> activeJobIds = new LinkedHashSet<>();

    @Column(name = "last_job_id")
    private String lastJobId;

    @Column(name = "job_started_at")
    private Instant jobStartedAt;

    @Column(name = "is_reactivation", nullable = false)
    private boolean reactivation;

    // task.reactivation_count at the time the run was opened.
    @Column(name = "reactivation_number", nullable = false)
    private int reactivationNumber;

    // Outcome of the most recent job that left the active set.
    @Column(name = "last_outcome")
    private String lastOutcome;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(Task task, boolean reactivation, int reactivationNumber, Instant createdAt) {
        this.task               = task;
        this.reactivation       = reactivation;
        this.reactivationNumber = reactivationNumber;
        this.createdAt          = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID        getId()                 { return id; }
    public Task        getTask()               { return task; }
    public RunStatus   getStatus()             { return status; }
    public Set<String> getActiveJobIds()       { return Collections.unmodifiableSet(activeJobIds); }
    public String      getLastJobId()          { return lastJobId; }
    public Instant     getJobStartedAt()       { return jobStartedAt; }
    public boolean     isReactivation()        { return reactivation; }
    public int         getReactivationNumber() { return reactivationNumber; }
    public String      getLastOutcome()        { return lastOutcome; }
    public Instant     getCreatedAt()          { return createdAt; }
    public Instant     getClosedAt()           { return closedAt; }

    public boolean hasLiveJobs() {
        return !activeJobIds.isEmpty();
    }

    // ------------------------------------------------------------------
    // Mutators - called by ActiveJobTracker
    // ------------------------------------------------------------------

    /** @return false if the id was already registered */
    public boolean addJob(String jobId, Instant at) {
        boolean added = activeJobIds.add(jobId);
        if (added) {
            if (activeJobIds.size() == 1) {
                jobStartedAt = at;   // set was empty before this job
            }
            lastJobId = jobId;
        }
        return added;
    }

    /** @return false if the id was not live */
    public boolean removeJob(String jobId, String outcome) {
        boolean removed = activeJobIds.remove(jobId);
        if (removed) {
            lastOutcome = outcome;
        }
        return removed;
    }

    public void clearJobs() {
        activeJobIds.clear();
    }

    public void markJobStarted(Instant at) {
        this.jobStartedAt = at;
    }

    public void close(RunStatus finalStatus, Instant at) {
        if (!finalStatus.isClosed()) {
            throw new IllegalArgumentException("Not a closing status: " + finalStatus);
        }
        this.status   = finalStatus;
        this.closedAt = at;
    }
}
