package com.boardpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The logical unit of work tracked by the controller, usually one board item.
 *
 * Three groups of columns are written by three different owners:
 *   - status / previous_status        : TransitionValidator only
 *   - is_locked / locked_at / locked_by : LockManager only, via conditional UPDATEs
 *   - counters and cooldown window    : CooldownPolicy and the orchestrator
 *
 * The lock columns are mapped read-only so a flush of this entity can never
 * overwrite a lock taken in another transaction. {@code @Version} turns every
 * status/counter flush into a compare-and-set; the lock UPDATEs do not touch it.
 *
 * DB table: tasks  (created by Flyway V1 migration). Rows are never deleted.
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Board item id; null for tasks created directly through the API.
    @Column(name = "external_id", unique = true)
    private String externalId;

    @Column
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status")
    private TaskStatus previousStatus;

    @Column(name = "is_locked", nullable = false, insertable = false, updatable = false)
    private boolean locked;

    @Column(name = "locked_at", insertable = false, updatable = false)
    private Instant lockedAt;

    @Column(name = "locked_by", insertable = false, updatable = false)
    private String lockedBy;

    // Accepted reactivations, never decremented.
    @Column(name = "reactivation_count", nullable = false)
    private int reactivationCount = 0;

    // Consecutive counted rejections since the task last reached COMPLETED.
    @Column(name = "failed_reactivation_attempts", nullable = false)
    private int failedReactivationAttempts = 0;

    @Column(name = "last_reactivation_attempt")
    private Instant lastReactivationAttempt;

    @Column(name = "cooldown_until")
    private Instant cooldownUntil;

    @Column(name = "reactivated_at")
    private Instant reactivatedAt;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Stamped by the writers from the service clock, not by a JPA callback.
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String externalId, String title, Instant createdAt) {
        this.externalId = externalId;
        this.title      = title;
        this.createdAt  = createdAt;
        this.updatedAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()                          { return id; }
    public String     getExternalId()                  { return externalId; }
    public String     getTitle()                       { return title; }
    public TaskStatus getStatus()                      { return status; }
    public TaskStatus getPreviousStatus()              { return previousStatus; }
    public boolean    isLocked()                       { return locked; }
    public Instant    getLockedAt()                    { return lockedAt; }
    public String     getLockedBy()                    { return lockedBy; }
    public int        getReactivationCount()           { return reactivationCount; }
    public int        getFailedReactivationAttempts()  { return failedReactivationAttempts; }
    public Instant    getLastReactivationAttempt()     { return lastReactivationAttempt; }
    public Instant    getCooldownUntil()               { return cooldownUntil; }
    public Instant    getReactivatedAt()               { return reactivatedAt; }
    public long       getVersion()                     { return version; }
    public Instant    getCreatedAt()                   { return createdAt; }
    public Instant    getUpdatedAt()                   { return updatedAt; }

    // ------------------------------------------------------------------
    // Mutators (see class comment for who may call what)
    // ------------------------------------------------------------------

    /** Status write. Callers must have validated the transition first. */
    public void recordStatusChange(TaskStatus next, Instant at) {
        this.previousStatus = this.status;
        this.status         = next;
        this.updatedAt      = at;
    }

    public void recordReactivation(Instant at) {
        this.reactivationCount++;
        this.reactivatedAt = at;
        this.updatedAt     = at;
    }

    /** Counter and cooldown writes go through plain setters; the writer stamps them here. */
    public void touch(Instant at) {
        this.updatedAt = at;
    }

    public void setFailedReactivationAttempts(int v)    { this.failedReactivationAttempts = v; }
    public void setLastReactivationAttempt(Instant t)   { this.lastReactivationAttempt = t; }
    public void setCooldownUntil(Instant t)             { this.cooldownUntil = t; }
    public void setTitle(String title)                  { this.title = title; }
}
