package com.previewstudio.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One unit of queued work: a job id plus the raw submission payload.
 *
 * The worker claims a WAITING entry with SELECT ... FOR UPDATE, sets
 * state = ACTIVE and a lock expiry, and renews the lock while the job
 * renders. An ACTIVE entry whose lock has expired is stalled.
 *
 * The entry shares its id with the Job record but has its own lifecycle:
 * it is pruned by queue retention while the Job record stays on disk.
 *
 * DB table: queue_entries  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "queue_entries")
public class QueueEntry {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false)
    private String jobId;

    @Column(name = "queue_name", nullable = false)
    private String queueName;

    // Serialized PreviewRequest.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueEntryState state = QueueEntryState.WAITING;

    @Column(name = "attempts_made", nullable = false)
    private int attemptsMade = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 1;

    // Base delay for exponential backoff between attempts.
    @Column(name = "backoff_delay_ms", nullable = false)
    private long backoffDelayMs = 0;

    @Column(nullable = false)
    private int progress = 0;

    // Identifies the worker that holds the lock. Null unless ACTIVE.
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Column(name = "stalled_count", nullable = false)
    private int stalledCount = 0;

    // Not claimable before this instant (backoff).
    @Column(name = "available_at", nullable = false)
    private Instant availableAt = Instant.now();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "failed_reason", columnDefinition = "TEXT")
    private String failedReason;

    @Column(name = "return_value", columnDefinition = "TEXT")
    private String returnValue;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected QueueEntry() {}   // required by JPA

    public QueueEntry(String jobId, String queueName, String payload) {
        this.jobId     = jobId;
        this.queueName = queueName;
        this.payload   = payload;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getJobId()          { return jobId; }
    public String          getQueueName()      { return queueName; }
    public String          getPayload()        { return payload; }
    public QueueEntryState getState()          { return state; }
    public int             getAttemptsMade()   { return attemptsMade; }
    public int             getMaxAttempts()    { return maxAttempts; }
    public long            getBackoffDelayMs() { return backoffDelayMs; }
    public int             getProgress()       { return progress; }
    public String          getWorkerId()       { return workerId; }
    public Instant         getLockedUntil()    { return lockedUntil; }
    public int             getStalledCount()   { return stalledCount; }
    public Instant         getAvailableAt()    { return availableAt; }
    public Instant         getCreatedAt()      { return createdAt; }
    public Instant         getStartedAt()      { return startedAt; }
    public Instant         getFinishedAt()     { return finishedAt; }
    public String          getFailedReason()   { return failedReason; }
    public String          getReturnValue()    { return returnValue; }

    public void setState(QueueEntryState state)       { this.state = state; }
    public void setAttemptsMade(int v)                { this.attemptsMade = v; }
    public void setMaxAttempts(int v)                 { this.maxAttempts = v; }
    public void setBackoffDelayMs(long v)             { this.backoffDelayMs = v; }
    public void setProgress(int progress)             { this.progress = progress; }
    public void setWorkerId(String workerId)          { this.workerId = workerId; }
    public void setLockedUntil(Instant t)             { this.lockedUntil = t; }
    public void setStalledCount(int v)                { this.stalledCount = v; }
    public void setAvailableAt(Instant t)             { this.availableAt = t; }
    public void setCreatedAt(Instant t)               { this.createdAt = t; }
    public void setStartedAt(Instant t)               { this.startedAt = t; }
    public void setFinishedAt(Instant t)              { this.finishedAt = t; }
    public void setFailedReason(String reason)        { this.failedReason = reason; }
    public void setReturnValue(String returnValue)    { this.returnValue = returnValue; }
}
