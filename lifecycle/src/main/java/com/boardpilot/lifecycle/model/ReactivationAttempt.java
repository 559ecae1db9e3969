package com.boardpilot.lifecycle.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry: one call into the reactivation orchestrator, accepted or not.
 *
 * Created when the trigger is received (decision = PENDING) and completed
 * exactly once. After {@link #complete} nothing on the row changes; a second
 * completion is a programming error and throws.
 *
 * The ledger is write-once, read-many. No control decision ever reads it.
 *
 * DB table: reactivation_attempts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "reactivation_attempts")
public class ReactivationAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    // Null when the attempt was rejected before a run existed.
    @Column(name = "run_id")
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, updatable = false)
    private TriggerType triggerType;

    // e.g. "monday.com", "admin-panel", "job-queue"
    @Column(name = "trigger_source", updatable = false)
    private String triggerSource;

    @Column(name = "payload", columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "requested_status", nullable = false, updatable = false)
    private TaskStatus requestedStatus;

    @Column(name = "confidence_score", updatable = false)
    private Double confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttemptDecision decision = AttemptDecision.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason")
    private RejectionReason rejectionReason;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "job_id")
    private String jobId;

    @Column(name = "previous_jobs_revoked", nullable = false)
    private int previousJobsRevoked = 0;

    // Only set for THROTTLED rejections.
    @Column(name = "cooldown_remaining_ms")
    private Long cooldownRemainingMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ReactivationAttempt() {}   // required by JPA

    public ReactivationAttempt(UUID taskId,
                               TriggerType triggerType,
                               String triggerSource,
                               String payload,
                               TaskStatus requestedStatus,
                               Double confidenceScore,
                               Instant receivedAt) {
        this.taskId          = taskId;
        this.triggerType     = triggerType;
        this.triggerSource   = triggerSource;
        this.payload         = payload;
        this.requestedStatus = requestedStatus;
        this.confidenceScore = confidenceScore;
        this.receivedAt      = receivedAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()                  { return id; }
    public UUID            getTaskId()              { return taskId; }
    public UUID            getRunId()               { return runId; }
    public TriggerType     getTriggerType()         { return triggerType; }
    public String          getTriggerSource()       { return triggerSource; }
    public String          getPayload()             { return payload; }
    public TaskStatus      getRequestedStatus()     { return requestedStatus; }
    public Double          getConfidenceScore()     { return confidenceScore; }
    public AttemptDecision getDecision()            { return decision; }
    public RejectionReason getRejectionReason()     { return rejectionReason; }
    public String          getMessage()             { return message; }
    public String          getJobId()               { return jobId; }
    public int             getPreviousJobsRevoked() { return previousJobsRevoked; }
    public Long            getCooldownRemainingMs() { return cooldownRemainingMs; }
    public String          getErrorMessage()        { return errorMessage; }
    public Instant         getReceivedAt()          { return receivedAt; }
    public Instant         getDecidedAt()           { return decidedAt; }
    public Instant         getCompletedAt()         { return completedAt; }
    public Long            getDurationMs()          { return durationMs; }

    public boolean isCompleted() { return completedAt != null; }
    public boolean isAccepted()  { return decision == AttemptDecision.ACCEPTED; }

    // ------------------------------------------------------------------
    // Decision recording
    // ------------------------------------------------------------------

    public void accept(UUID runId, String jobId, int previousJobsRevoked, String message, Instant at) {
        requireOpen();
        this.decision            = AttemptDecision.ACCEPTED;
        this.runId               = runId;
        this.jobId               = jobId;
        this.previousJobsRevoked = previousJobsRevoked;
        this.message             = message;
        this.decidedAt           = at;
    }

    public void reject(RejectionReason reason, String message, Duration cooldownRemaining, Instant at) {
        requireOpen();
        this.decision        = AttemptDecision.REJECTED;
        this.rejectionReason = reason;
        this.message         = message;
        this.decidedAt       = at;
        if (cooldownRemaining != null) {
            this.cooldownRemainingMs = cooldownRemaining.toMillis();
        }
    }

    public void fail(String errorMessage, Instant at) {
        reject(RejectionReason.INTERNAL_ERROR, "Internal error while processing trigger", null, at);
        this.errorMessage = errorMessage;
    }

    /** Final write: stamps completed_at and computes the duration from received_at. */
    public void complete(Instant at) {
        requireOpen();
        if (decision == AttemptDecision.PENDING) {
            throw new IllegalStateException("Attempt " + id + " has no decision yet");
        }
        this.completedAt = at;
        this.durationMs  = Duration.between(receivedAt, at).toMillis();
    }

    private void requireOpen() {
        if (completedAt != null) {
            throw new IllegalStateException("Attempt " + id + " is already completed");
        }
    }
}
