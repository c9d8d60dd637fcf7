package com.previewstudio.orchestrator.api;

import com.previewstudio.orchestrator.api.dto.ActiveJobResponse;
import com.previewstudio.orchestrator.api.dto.JobActionResponse;
import com.previewstudio.orchestrator.api.dto.JobListResponse;
import com.previewstudio.orchestrator.api.dto.JobResponse;
import com.previewstudio.orchestrator.api.dto.StartJobResponse;
import com.previewstudio.orchestrator.api.dto.TargetResponse;
import com.previewstudio.orchestrator.artifact.ImageFolder;
import com.previewstudio.orchestrator.artifact.JobArtifacts;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.model.PreviewRequest;
import com.previewstudio.orchestrator.queue.QueueService;
import com.previewstudio.orchestrator.queue.QueueStats;
import com.previewstudio.orchestrator.service.JobConflictException;
import com.previewstudio.orchestrator.service.JobOrchestrator;
import com.previewstudio.orchestrator.service.ValidationException;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * REST API for preview jobs.
 *
 * POST   /api/preview/start                   submit a preview job
 * GET    /api/preview/status/{id}             current job record
 * GET    /api/preview/events/{id}             server-sent event stream
 * POST   /api/preview/cancel/{id}             stop the renderer
 * DELETE /api/preview/force/{id}              mark a stuck job failed
 * POST   /api/preview/pause/{id}              pause the renderer container
 * POST   /api/preview/resume/{id}             unpause it
 * POST   /api/preview/retry/{id}              re-queue a failed job
 * GET    /api/preview/active                  the running or paused job, if any
 * GET    /api/preview/jobs                    paginated listing, newest first
 * GET    /api/preview/artifacts/{id}          before/after/draft image URLs
 * GET    /api/preview/image/{id}/{folder}/{f} one image
 * GET    /api/preview/logs/{id}               renderer log
 * GET    /api/preview/targets                 selectable targets
 * GET    /api/preview/queue                   queue counters
 * POST   /api/preview/queue/pause             stop dispatching new jobs
 * POST   /api/preview/queue/resume            start dispatching again
 *
 * Control operations the job's status does not allow answer 409.
 */
@RestController
@RequestMapping("/api/preview")
public class PreviewController {

    private static final Duration IMAGE_MAX_AGE = Duration.ofHours(1);
    private static final Duration DRAFT_MAX_AGE = Duration.ofMinutes(1);

    private final JobOrchestrator orchestrator;
    private final JobEventStream  eventStream;
    private final QueueService    queue;

    public PreviewController(JobOrchestrator orchestrator, JobEventStream eventStream, QueueService queue) {
        this.orchestrator = orchestrator;
        this.eventStream  = eventStream;
        this.queue        = queue;
    }

    /**
     * Submit a preview job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/preview/start \
     *     -H "Content-Type: application/json" \
     *     -d '{"configYaml":"libraries: {}","testOptions":{"selectedTargets":["matrix"]}}'
     */
    @PostMapping("/start")
    public ResponseEntity<StartJobResponse> start(@RequestBody PreviewRequest request) {
        String jobId = orchestrator.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StartJobResponse.created(jobId, JobStatus.PENDING.value()));
    }

    @GetMapping("/status/{id}")
    public JobResponse status(@PathVariable String id) {
        return JobResponse.from(orchestrator.getJobMeta(id));
    }

    @GetMapping(path = "/events/{id}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        return eventStream.open(id);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    @PostMapping("/cancel/{id}")
    public JobActionResponse cancel(@PathVariable String id) {
        if (!orchestrator.cancelJob(id)) {
            throw new JobConflictException("Job could not be cancelled (may already be completed)");
        }
        return JobActionResponse.ok(id, JobStatus.CANCELLED.value(), "Job cancelled");
    }

    @DeleteMapping("/force/{id}")
    public JobActionResponse forceFail(@PathVariable String id) {
        if (!orchestrator.forceFailJob(id)) {
            throw new JobConflictException("Job has already finished");
        }
        return JobActionResponse.ok(id, JobStatus.FAILED.value(), "Job forcefully marked as failed");
    }

    @PostMapping("/pause/{id}")
    public JobActionResponse pause(@PathVariable String id) {
        if (!orchestrator.pauseJob(id)) {
            throw new JobConflictException("Job could not be paused (may not be running)");
        }
        return JobActionResponse.ok(id, JobStatus.PAUSED.value(), "Job paused");
    }

    @PostMapping("/resume/{id}")
    public JobActionResponse resume(@PathVariable String id) {
        if (!orchestrator.resumeJob(id)) {
            throw new JobConflictException("Job could not be resumed (may not be paused)");
        }
        return JobActionResponse.ok(id, JobStatus.RUNNING.value(), "Job resumed");
    }

    @PostMapping("/retry/{id}")
    public JobActionResponse retry(@PathVariable String id) {
        if (!orchestrator.retryJob(id)) {
            throw new JobConflictException("Only failed jobs that are still on the queue can be retried");
        }
        return JobActionResponse.ok(id, JobStatus.PENDING.value(), "Job queued for retry");
    }

    // ------------------------------------------------------------------
    // Listings
    // ------------------------------------------------------------------

    @GetMapping("/active")
    public ActiveJobResponse active() {
        return orchestrator.getActiveJob()
                .map(job -> new ActiveJobResponse(true, JobResponse.from(job)))
                .orElseGet(ActiveJobResponse::none);
    }

    @GetMapping("/jobs")
    public JobListResponse jobs(@RequestParam(defaultValue = "1")  int page,
                                @RequestParam(defaultValue = "20") int limit,
                                @RequestParam(required = false)    String status) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = JobStatus.fromValue(status).orElseThrow(() ->
                    new ValidationException("Unknown job status: " + status));
        }
        return JobListResponse.from(orchestrator.listJobs(page, limit, filter));
    }

    @GetMapping("/targets")
    public TargetResponse targets() {
        return TargetResponse.from(orchestrator.availableTargets());
    }

    @GetMapping("/queue")
    public QueueStats queueStats() {
        return queue.stats();
    }

    @PostMapping("/queue/pause")
    public QueueStats pauseQueue() {
        queue.pause();
        return queue.stats();
    }

    @PostMapping("/queue/resume")
    public QueueStats resumeQueue() {
        queue.resume();
        return queue.stats();
    }

    // ------------------------------------------------------------------
    // Artifacts
    // ------------------------------------------------------------------

    @GetMapping("/artifacts/{id}")
    public JobArtifacts artifacts(@PathVariable String id) {
        return orchestrator.getJobArtifacts(id);
    }

    /**
     * Serve one image. The folder must be input, output or draft and the
     * filename a plain name; anything else is rejected before touching disk.
     */
    @GetMapping("/image/{id}/{folder}/{filename}")
    public ResponseEntity<Resource> image(@PathVariable String id,
                                          @PathVariable String folder,
                                          @PathVariable String filename) {
        ImageFolder imageFolder = ImageFolder.fromValue(folder).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid folder. Must be one of input, output, draft."));

        Path image = orchestrator.getImagePath(id, imageFolder, filename).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Image not found"));

        Duration maxAge = imageFolder == ImageFolder.DRAFT ? DRAFT_MAX_AGE : IMAGE_MAX_AGE;
        return ResponseEntity.ok()
                .contentType(MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM))
                .cacheControl(CacheControl.maxAge(maxAge))
                .body(new FileSystemResource(image));
    }

    @GetMapping("/logs/{id}")
    public ResponseEntity<Resource> logs(@PathVariable String id) {
        Path logFile = orchestrator.getLogPath(id);
        if (!Files.isRegularFile(logFile)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Logs not found");
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(new FileSystemResource(logFile));
    }
}
