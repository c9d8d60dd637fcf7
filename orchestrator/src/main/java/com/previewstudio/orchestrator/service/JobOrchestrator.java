package com.previewstudio.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.artifact.ArtifactResolver;
import com.previewstudio.orchestrator.artifact.ImageFolder;
import com.previewstudio.orchestrator.artifact.JobArtifacts;
import com.previewstudio.orchestrator.event.JobEvent;
import com.previewstudio.orchestrator.event.JobEventBus;
import com.previewstudio.orchestrator.event.JobEventHandler;
import com.previewstudio.orchestrator.event.JobEventType;
import com.previewstudio.orchestrator.event.Subscription;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.model.PreviewRequest;
import com.previewstudio.orchestrator.queue.JobResult;
import com.previewstudio.orchestrator.queue.QueueEventListener;
import com.previewstudio.orchestrator.queue.QueueService;
import com.previewstudio.orchestrator.repository.JobPaths;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.repository.JobStoreException;
import com.previewstudio.orchestrator.runner.ContainerRunner;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Facade over the preview job pipeline.
 *
 * Owns the link between what happens (queue transitions, runner events)
 * and what is recorded (the Job record): it listens to every job event on
 * the bus and to the queue, and applies the matching status and progress
 * updates through JobRecordStore.
 *
 * Operations on an unknown job id throw JobNotFoundException. Operations
 * that are not allowed in the job's current status return false.
 */
@Service
public class JobOrchestrator implements QueueEventListener {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    static final String FORCE_FAIL_ERROR = "Job forcefully terminated by user";

    private static final int MAX_PAGE_SIZE = 100;

    private final JobRecordStore      store;
    private final QueueService        queue;
    private final ContainerRunner     runner;
    private final JobEventBus         events;
    private final ArtifactResolver    artifacts;
    private final JobPaths            paths;
    private final TargetResolver      targetResolver;
    private final PreviewJobProcessor processor;
    private final ObjectMapper        json;
    private final MeterRegistry       meters;

    public JobOrchestrator(JobRecordStore store,
                           QueueService queue,
                           ContainerRunner runner,
                           JobEventBus events,
                           ArtifactResolver artifacts,
                           JobPaths paths,
                           TargetResolver targetResolver,
                           PreviewJobProcessor processor,
                           ObjectMapper objectMapper,
                           MeterRegistry meters) {
        this.store          = store;
        this.queue          = queue;
        this.runner         = runner;
        this.events         = events;
        this.artifacts      = artifacts;
        this.paths          = paths;
        this.targetResolver = targetResolver;
        this.processor      = processor;
        this.json           = objectMapper;
        this.meters         = meters;
    }

    /** Wire the bus and the queue to this orchestrator and start accepting work. */
    @PostConstruct
    public void start() {
        events.subscribeAll(this::onJobEvent);
        queue.addListener(this);
        queue.initialize(processor);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate and enqueue a preview job.
     *
     * @return the new job id; the job is PENDING with progress 0
     * @throws ValidationException before anything is persisted
     * @throws JobStoreException when the job cannot be set up; nothing is left queued
     */
    public String createJob(PreviewRequest request) {
        validate(request);

        String jobId = queue.addJob(toJson(request), null);
        try {
            paths.createWorkingDirs(jobId);
        } catch (IOException e) {
            JobStoreException failure = new JobStoreException("Failed to create working directories for job " + jobId, e);
            queue.withdraw(jobId, failure);
            throw failure;
        }

        log.info("Job {} created ({} target filter(s))", jobId, request.testOptions().selectedTargets().size());
        events.emit(jobId, JobEvent.log("Job created: " + jobId));
        return jobId;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Job getJobMeta(String jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public JobArtifacts getJobArtifacts(String jobId) {
        return artifacts.artifacts(getJobMeta(jobId));
    }

    /** Empty for unsafe names and missing files. */
    public Optional<Path> getImagePath(String jobId, ImageFolder folder, String filename) {
        return artifacts.resolveImagePath(jobId, folder, filename);
    }

    public Path getLogPath(String jobId) {
        getJobMeta(jobId);
        return artifacts.logPath(jobId);
    }

    public Optional<Job> getActiveJob() {
        return store.activeJob();
    }

    /**
     * Newest-first listing. Page is 1-based; limit is clamped to 1..100;
     * a null status means all statuses.
     */
    public JobPage listJobs(int page, int limit, JobStatus status) {
        int safePage  = Math.max(1, page);
        int safeLimit = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        List<Job> jobs = store.list().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .toList();
        return JobPage.of(jobs, safePage, safeLimit);
    }

    public List<PreviewTarget> availableTargets() {
        return targetResolver.catalogue();
    }

    /** Receive every event of one job until the returned handle is closed. */
    public Subscription subscribe(String jobId, JobEventHandler handler) {
        getJobMeta(jobId);
        return events.subscribe(jobId, handler);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Stop the job's renderer. The record becomes CANCELLED only once the
     * runner confirms the container was stopped.
     */
    public boolean cancelJob(String jobId) {
        Job job = getJobMeta(jobId);
        if (!job.getStatus().isActive()) return false;

        if (!runner.cancel(jobId)) {
            log.warn("Job {} could not be cancelled: no renderer container is running", jobId);
            return false;
        }
        if (store.updateStatus(jobId, JobStatus.CANCELLED, job.getProgress(), null)) {
            countFinished(JobStatus.CANCELLED);
        }
        events.emit(jobId, JobEvent.log("Job cancelled by user", Map.of("status", JobStatus.CANCELLED.value())));
        return true;
    }

    public boolean pauseJob(String jobId) {
        Job job = getJobMeta(jobId);
        if (job.getStatus() != JobStatus.RUNNING) return false;
        if (!runner.pause(jobId)) return false;

        store.updateStatus(jobId, JobStatus.PAUSED, job.getProgress(), null);
        events.emit(jobId, JobEvent.progress("Job paused", Map.of("progress", job.getProgress(), "paused", true)));
        return true;
    }

    public boolean resumeJob(String jobId) {
        Job job = getJobMeta(jobId);
        if (job.getStatus() != JobStatus.PAUSED) return false;
        if (!runner.resume(jobId)) return false;

        store.updateStatus(jobId, JobStatus.RUNNING, job.getProgress(), null);
        events.emit(jobId, JobEvent.progress("Job resumed", Map.of("progress", job.getProgress(), "paused", false)));
        return true;
    }

    /**
     * Mark a stuck job FAILED without waiting for the runner. A waiting
     * queue entry is dropped; a running container is left to finish and
     * its later events no longer change the record.
     */
    public boolean forceFailJob(String jobId) {
        Job job = getJobMeta(jobId);
        if (job.getStatus().isTerminal()) return false;

        queue.discard(jobId, FORCE_FAIL_ERROR);
        if (!store.forceFail(jobId, FORCE_FAIL_ERROR)) return false;

        countFinished(JobStatus.FAILED);
        log.warn("Job {} force-failed from status {}", jobId, job.getStatus().value());
        events.emit(jobId, new JobEvent(JobEventType.ERROR, Instant.now(), "Job forcefully terminated",
                Map.of("error", FORCE_FAIL_ERROR)));
        return true;
    }

    /** Put a FAILED job back on the queue, with progress and error cleared. */
    public boolean retryJob(String jobId) {
        Job job = getJobMeta(jobId);
        if (job.getStatus() != JobStatus.FAILED) return false;

        if (!queue.retry(jobId)) {
            log.warn("Job {} cannot be retried: its queue entry is no longer failed or was cleaned up", jobId);
            return false;
        }
        store.resetForRetry(jobId);
        events.emit(jobId, JobEvent.log("Job queued for retry", Map.of("status", JobStatus.PENDING.value())));
        return true;
    }

    // ------------------------------------------------------------------
    // Event bus → Job record
    // ------------------------------------------------------------------

    void onJobEvent(String jobId, JobEvent event) {
        Optional<Job> found = store.get(jobId);   // also loads the record into the cache
        if (found.isEmpty() || found.get().getStatus().isTerminal()) return;
        Job job = found.get();

        switch (event.type()) {
            case PROGRESS -> {
                Integer progress = event.progressValue();
                if (progress != null) store.updateStatus(jobId, job.getStatus(), progress, null);
            }
            case COMPLETE -> {
                recordExitCode(jobId, event.exitCode());
                if (store.updateStatus(jobId, JobStatus.COMPLETED, 100, null)) {
                    countFinished(JobStatus.COMPLETED);
                }
            }
            case ERROR -> {
                recordExitCode(jobId, event.exitCode());
                int progress = event.progressValue() != null ? event.progressValue() : job.getProgress();
                if (store.updateStatus(jobId, JobStatus.FAILED, progress, event.message())) {
                    countFinished(JobStatus.FAILED);
                }
            }
            default -> { }
        }
    }

    // ------------------------------------------------------------------
    // Queue → Job record
    // ------------------------------------------------------------------

    @Override
    public void onActive(String jobId, int attempt) {
        store.get(jobId);
        if (store.updateStatus(jobId, JobStatus.RUNNING, 5, null)) {
            if (attempt > 1) events.emit(jobId, JobEvent.log("Attempt " + attempt + " started"));
            events.emit(jobId, JobEvent.progress(5, "Job started"));
        }
    }

    @Override
    public void onCompleted(String jobId, JobResult result) {
        if (result != null && result.cancelled()) return;
        Optional<Job> job = store.get(jobId);
        if (job.isEmpty() || job.get().getStatus().isTerminal()) return;

        if (store.updateStatus(jobId, JobStatus.COMPLETED, 100, null)) {
            countFinished(JobStatus.COMPLETED);
            events.emit(jobId, JobEvent.complete(result != null ? result.exitCode() : 0));
        }
    }

    @Override
    public void onFailed(String jobId, String reason, boolean willRetry) {
        Optional<Job> found = store.get(jobId);
        if (found.isEmpty()) return;
        Job job = found.get();

        if (willRetry) {
            if (job.getStatus() == JobStatus.FAILED) store.resetForRetry(jobId);
            events.emit(jobId, JobEvent.log("Attempt failed, will retry: " + reason));
            return;
        }
        if (job.getStatus().isTerminal()) return;

        if (store.updateStatus(jobId, JobStatus.FAILED, job.getProgress(), reason)) {
            countFinished(JobStatus.FAILED);
            events.emit(jobId, JobEvent.error("Job failed: " + reason));
        }
    }

    @Override
    public void onStalled(String jobId) {
        events.emit(jobId, JobEvent.log("Job stalled: worker lock expired"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void validate(PreviewRequest request) {
        if (request == null) throw new ValidationException("Request body is required");
        if (request.configYaml() == null || request.configYaml().isBlank()) {
            throw new ValidationException("configYaml is required");
        }
        Set<String> known = targetResolver.catalogue().stream()
                .map(PreviewTarget::id)
                .collect(Collectors.toSet());
        List<String> unknown = request.testOptions().selectedTargets().stream()
                .filter(id -> !known.contains(id))
                .toList();
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown preview target(s): " + String.join(", ", unknown));
        }
    }

    private void recordExitCode(String jobId, Integer exitCode) {
        if (exitCode != null) store.update(jobId, job -> job.setExitCode(exitCode));
    }

    private void countFinished(JobStatus status) {
        meters.counter("preview.jobs.finished", "status", status.value()).increment();
    }

    private String toJson(PreviewRequest request) {
        try {
            return json.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request cannot be serialized: " + e.getOriginalMessage());
        }
    }
}
