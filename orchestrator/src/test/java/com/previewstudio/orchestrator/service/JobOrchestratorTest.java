package com.previewstudio.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.previewstudio.orchestrator.artifact.ArtifactResolver;
import com.previewstudio.orchestrator.artifact.JobArtifacts;
import com.previewstudio.orchestrator.event.JobEvent;
import com.previewstudio.orchestrator.event.JobEventBus;
import com.previewstudio.orchestrator.model.ArtworkSource;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.model.JobTarget;
import com.previewstudio.orchestrator.model.MediaType;
import com.previewstudio.orchestrator.model.PreviewRequest;
import com.previewstudio.orchestrator.model.TestOptions;
import com.previewstudio.orchestrator.queue.JobResult;
import com.previewstudio.orchestrator.queue.QueueService;
import com.previewstudio.orchestrator.repository.JobIds;
import com.previewstudio.orchestrator.repository.JobPaths;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.repository.JobStoreException;
import com.previewstudio.orchestrator.runner.ContainerRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * JobOrchestrator over a real record store and event bus. The queue and the
 * container runner are mocked; their transitions are driven by calling the
 * listener methods and emitting the events the runner would emit.
 */
@ExtendWith(MockitoExtension.class)
class JobOrchestratorTest {

    static final String YAML = "libraries: {}";

    @TempDir Path jobsRoot;

    @Mock QueueService        queue;
    @Mock ContainerRunner     runner;
    @Mock PreviewJobProcessor processor;

    JobPaths            paths;
    JobRecordStore      store;
    JobEventBus         bus;
    SimpleMeterRegistry meters;
    JobOrchestrator     orchestrator;

    @BeforeEach
    void setUp() {
        ObjectMapper json = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        paths  = new JobPaths(jobsRoot);
        store  = new JobRecordStore(paths, json);
        bus    = new JobEventBus();
        meters = new SimpleMeterRegistry();
        orchestrator = new JobOrchestrator(store, queue, runner, bus, new ArtifactResolver(paths), paths,
                new PresetTargetResolver(), processor, json, meters);
        orchestrator.start();
    }

    // ------------------------------------------------------------------
    // createJob()
    // ------------------------------------------------------------------

    @Test
    void createJob_newJobIsPendingWithZeroProgress() {
        enqueueLikeTheQueue();

        String jobId = orchestrator.createJob(new PreviewRequest(YAML, null));

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getProgress()).isZero();
        assertThat(paths.inputDir(jobId)).isDirectory();
        assertThat(paths.logsDir(jobId)).isDirectory();
        verify(queue).initialize(processor);
    }

    @Test
    void createJob_blankYaml_isRejectedBeforeAnythingIsStored() {
        assertThatThrownBy(() -> orchestrator.createJob(new PreviewRequest("  ", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("configYaml is required");
        verify(queue, never()).addJob(any(), any());
        assertThat(store.list()).isEmpty();
    }

    @Test
    void createJob_unknownTarget_isRejected() {
        PreviewRequest request = new PreviewRequest(YAML, new TestOptions(List.of("matrix", "alien"), null, null, null));

        assertThatThrownBy(() -> orchestrator.createJob(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("alien");
        verify(queue, never()).addJob(any(), any());
    }

    @Test
    void createJob_workingDirsFail_withdrawsSubmission() throws Exception {
        String jobId = "job-without-dirs";
        when(queue.addJob(anyString(), any())).thenAnswer(inv -> {
            store.save(jobId, new Job(jobId, Instant.now()));
            return jobId;
        });
        // A file where input/ should go makes directory creation fail.
        Files.createDirectories(paths.jobDir(jobId));
        Files.writeString(paths.inputDir(jobId), "not a directory");

        assertThatThrownBy(() -> orchestrator.createJob(new PreviewRequest(YAML, null)))
                .isInstanceOf(JobStoreException.class)
                .hasMessageContaining(jobId);

        verify(queue).withdraw(eq(jobId), any(JobStoreException.class));
    }

    @Test
    void createJob_secondSubmissionStaysPendingWhileFirstRuns() {
        enqueueLikeTheQueue();
        String first  = orchestrator.createJob(new PreviewRequest(YAML, null));
        String second = orchestrator.createJob(new PreviewRequest(YAML, null));

        orchestrator.onActive(first, 1);

        assertThat(orchestrator.getJobMeta(first).getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(orchestrator.getJobMeta(second).getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(orchestrator.getActiveJob()).map(Job::getJobId).contains(first);
    }

    @Test
    void getJobMeta_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> orchestrator.getJobMeta("nope"))
                .isInstanceOf(JobNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Lifecycle scenarios
    // ------------------------------------------------------------------

    @Test
    void twoTargetRun_completesWithArtifactsForBoth() throws Exception {
        String jobId = runningJob();
        store.update(jobId, job -> job.setTargets(List.of(
                new JobTarget("matrix", "The Matrix", MediaType.MOVIE, ArtworkSource.ASSET_DIRECTORY, List.of()),
                new JobTarget("dune", "Dune", MediaType.MOVIE, ArtworkSource.ORIGINAL_POSTER, List.of()))));
        for (String id : List.of("matrix", "dune")) {
            Files.write(paths.inputDir(jobId).resolve(id + ".jpg"), new byte[]{1});
            Files.write(paths.outputDir(jobId).resolve(id + "_after.png"), new byte[]{1});
        }

        bus.emit(jobId, JobEvent.progress(50, "Rendering overlays..."));
        bus.emit(jobId, JobEvent.progress(90, "Container exited with code: 0"));
        bus.emit(jobId, JobEvent.complete(0));
        orchestrator.onCompleted(jobId, JobResult.success());

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getExitCode()).isZero();
        assertThat(job.getCompletedAt()).isNotNull();

        JobArtifacts artifacts = orchestrator.getJobArtifacts(jobId);
        assertThat(artifacts.items()).extracting(JobArtifacts.Item::id).containsExactly("matrix", "dune");
        assertThat(artifacts.items()).allMatch(item -> item.afterUrl() != null);
        assertThat(meters.counter("preview.jobs.finished", "status", "completed").count()).isEqualTo(1);
    }

    @Test
    void exitCodeOne_failsWithRendererMessage() {
        String jobId = runningJob();

        bus.emit(jobId, JobEvent.error("Render failed with exit code 1", 1));
        orchestrator.onFailed(jobId, "Renderer exited with code 1", false);

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getExitCode()).isEqualTo(1);
        assertThat(job.getError()).isEqualTo("Render failed with exit code 1");
        assertThat(meters.counter("preview.jobs.finished", "status", "failed").count()).isEqualTo(1);
    }

    @Test
    void processorFailureBeforeRender_isRecordedFromQueue() {
        String jobId = runningJob();
        List<JobEvent> seen = collect(jobId);

        orchestrator.onFailed(jobId, "No targets selected for preview.", false);

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("No targets selected for preview.");
        assertThat(seen).extracting(JobEvent::message).contains("Job failed: No targets selected for preview.");
    }

    @Test
    void progressEvents_neverLowerRecordedProgress() {
        String jobId = runningJob();

        bus.emit(jobId, JobEvent.progress(50, "Rendering"));
        bus.emit(jobId, JobEvent.progress(20, "late event"));

        assertThat(orchestrator.getJobMeta(jobId).getProgress()).isEqualTo(50);
    }

    // ------------------------------------------------------------------
    // cancelJob()
    // ------------------------------------------------------------------

    @Test
    void cancelJob_running_isCancelledOnceRunnerConfirms() {
        String jobId = runningJob();
        List<JobEvent> seen = collect(jobId);
        when(runner.cancel(jobId)).thenReturn(true);

        assertThat(orchestrator.cancelJob(jobId)).isTrue();

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(seen).anyMatch(e -> "cancelled".equals(e.status()));

        // A late completion from the renderer does not resurrect the job.
        bus.emit(jobId, JobEvent.complete(0));
        orchestrator.onCompleted(jobId, JobResult.cancelledRun(137));
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cancelJob_runnerHasNoContainer_returnsFalseAndKeepsStatus() {
        String jobId = runningJob();
        when(runner.cancel(jobId)).thenReturn(false);

        assertThat(orchestrator.cancelJob(jobId)).isFalse();
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void cancelJob_pending_returnsFalse() {
        String jobId = pendingJob();

        assertThat(orchestrator.cancelJob(jobId)).isFalse();
        verify(runner, never()).cancel(anyString());
    }

    // ------------------------------------------------------------------
    // forceFailJob()
    // ------------------------------------------------------------------

    @Test
    void forceFailJob_running_failsWithoutTouchingRunner() {
        String jobId = runningJob();
        List<JobEvent> seen = collect(jobId);

        assertThat(orchestrator.forceFailJob(jobId)).isTrue();

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Job forcefully terminated by user");
        assertThat(seen).extracting(JobEvent::message).contains("Job forcefully terminated");
        verify(queue).discard(jobId, "Job forcefully terminated by user");
        verifyNoInteractions(runner);

        bus.emit(jobId, JobEvent.complete(0));
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void forceFailJob_pending_dropsQueueEntry() {
        String jobId = pendingJob();

        assertThat(orchestrator.forceFailJob(jobId)).isTrue();
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.FAILED);
        verify(queue).discard(jobId, "Job forcefully terminated by user");
    }

    @Test
    void forceFailJob_completed_returnsFalse() {
        String jobId = runningJob();
        bus.emit(jobId, JobEvent.complete(0));

        assertThat(orchestrator.forceFailJob(jobId)).isFalse();
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // pause / resume / retry
    // ------------------------------------------------------------------

    @Test
    void pauseAndResume_roundTripKeepsProgress() {
        String jobId = runningJob();
        bus.emit(jobId, JobEvent.progress(50, "Rendering"));
        when(runner.pause(jobId)).thenReturn(true);
        when(runner.resume(jobId)).thenReturn(true);

        assertThat(orchestrator.pauseJob(jobId)).isTrue();
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.PAUSED);
        assertThat(orchestrator.getActiveJob()).isPresent();

        assertThat(orchestrator.resumeJob(jobId)).isTrue();
        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getProgress()).isEqualTo(50);
    }

    @Test
    void resumeJob_notPaused_returnsFalse() {
        String jobId = runningJob();
        assertThat(orchestrator.resumeJob(jobId)).isFalse();
        verify(runner, never()).resume(anyString());
    }

    @Test
    void retryJob_failed_isPendingAgainWithProgressCleared() {
        String jobId = runningJob();
        bus.emit(jobId, JobEvent.error("Render failed with exit code 1", 1));
        when(queue.retry(jobId)).thenReturn(true);

        assertThat(orchestrator.retryJob(jobId)).isTrue();

        Job job = orchestrator.getJobMeta(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getProgress()).isZero();
        assertThat(job.getError()).isNull();
        assertThat(job.getExitCode()).isNull();
    }

    @Test
    void retryJob_queueEntryGone_returnsFalse() {
        String jobId = runningJob();
        bus.emit(jobId, JobEvent.error("boom"));
        when(queue.retry(jobId)).thenReturn(false);

        assertThat(orchestrator.retryJob(jobId)).isFalse();
        assertThat(orchestrator.getJobMeta(jobId).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void retryJob_completed_returnsFalse() {
        String jobId = runningJob();
        bus.emit(jobId, JobEvent.complete(0));

        assertThat(orchestrator.retryJob(jobId)).isFalse();
        verify(queue, never()).retry(anyString());
    }

    // ------------------------------------------------------------------
    // listJobs()
    // ------------------------------------------------------------------

    @Test
    void listJobs_paginatesNewestFirstAndFiltersByStatus() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            String id = "job-" + i;
            store.save(id, new Job(id, t0.plusSeconds(i)));
        }
        store.updateStatus("job-4", JobStatus.RUNNING, 5, null);

        JobPage first = orchestrator.listJobs(1, 2, null);
        assertThat(first.jobs()).extracting(Job::getJobId).containsExactly("job-4", "job-3");
        assertThat(first.total()).isEqualTo(5);
        assertThat(first.totalPages()).isEqualTo(3);
        assertThat(first.hasNextPage()).isTrue();
        assertThat(first.hasPrevPage()).isFalse();

        JobPage last = orchestrator.listJobs(3, 2, null);
        assertThat(last.jobs()).extracting(Job::getJobId).containsExactly("job-0");
        assertThat(last.hasNextPage()).isFalse();

        assertThat(orchestrator.listJobs(1, 20, JobStatus.RUNNING).jobs())
                .extracting(Job::getJobId).containsExactly("job-4");
        assertThat(orchestrator.listJobs(1, 1000, null).limit()).isEqualTo(100);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Make the mocked queue behave like the real one on submission: it creates the record. */
    private void enqueueLikeTheQueue() {
        when(queue.addJob(anyString(), any())).thenAnswer(inv -> {
            String id = JobIds.newId();
            store.save(id, new Job(id, Instant.now()));
            return id;
        });
    }

    private String pendingJob() {
        enqueueLikeTheQueue();
        return orchestrator.createJob(new PreviewRequest(YAML, null));
    }

    private String runningJob() {
        String jobId = pendingJob();
        orchestrator.onActive(jobId, 1);
        return jobId;
    }

    private List<JobEvent> collect(String jobId) {
        List<JobEvent> seen = new ArrayList<>();
        bus.subscribe(jobId, (id, e) -> seen.add(e));
        return seen;
    }
}
