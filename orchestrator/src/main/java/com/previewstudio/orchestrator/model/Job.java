package com.previewstudio.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One preview rendering run submitted by a user.
 *
 * A Job owns an ordered list of Targets, one per media item rendered.
 * The record is persisted as {jobsRoot}/{jobId}/job-meta.json by
 * JobRecordStore and mutated by the queue worker and by renderer events.
 *
 * Invariant: completedAt is set if and only if the status is terminal.
 */
public class Job {

    private String    jobId;
    private JobStatus status = JobStatus.PENDING;

    // 0-100, only lowered by an explicit retry.
    private int progress = 0;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    // Renderer container exit code, once the container has exited.
    private Integer exitCode;
    private String  error;

    private List<JobTarget> targets  = new ArrayList<>();
    private List<String>    warnings = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by Jackson

    public Job(String jobId, Instant createdAt) {
        this.jobId     = jobId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /** Detached copy; the store hands these out so callers never share the cached instance. */
    public Job copy() {
        Job c = new Job(jobId, createdAt);
        c.status      = status;
        c.progress    = progress;
        c.updatedAt   = updatedAt;
        c.completedAt = completedAt;
        c.exitCode    = exitCode;
        c.error       = error;
        c.targets     = new ArrayList<>(targets);
        c.warnings    = new ArrayList<>(warnings);
        return c;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getJobId()       { return jobId; }
    public JobStatus       getStatus()      { return status; }
    public int             getProgress()    { return progress; }
    public Instant         getCreatedAt()   { return createdAt; }
    public Instant         getUpdatedAt()   { return updatedAt; }
    public Instant         getCompletedAt() { return completedAt; }
    public Integer         getExitCode()    { return exitCode; }
    public String          getError()       { return error; }
    public List<JobTarget> getTargets()     { return targets; }
    public List<String>    getWarnings()    { return warnings; }

    public void setJobId(String jobId)               { this.jobId = jobId; }
    public void setStatus(JobStatus status)          { this.status = status; }
    public void setProgress(int progress)            { this.progress = progress; }
    public void setCreatedAt(Instant t)              { this.createdAt = t; }
    public void setUpdatedAt(Instant t)              { this.updatedAt = t; }
    public void setCompletedAt(Instant t)            { this.completedAt = t; }
    public void setExitCode(Integer exitCode)        { this.exitCode = exitCode; }
    public void setError(String error)               { this.error = error; }
    public void setTargets(List<JobTarget> targets)  { this.targets = targets == null ? new ArrayList<>() : new ArrayList<>(targets); }
    public void setWarnings(List<String> warnings)   { this.warnings = warnings == null ? new ArrayList<>() : new ArrayList<>(warnings); }
}
