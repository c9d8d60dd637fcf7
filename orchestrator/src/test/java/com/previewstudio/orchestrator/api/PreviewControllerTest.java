package com.previewstudio.orchestrator.api;

import com.previewstudio.orchestrator.artifact.ImageFolder;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.model.MediaType;
import com.previewstudio.orchestrator.queue.QueueService;
import com.previewstudio.orchestrator.queue.QueueStats;
import com.previewstudio.orchestrator.service.JobNotFoundException;
import com.previewstudio.orchestrator.service.JobOrchestrator;
import com.previewstudio.orchestrator.service.JobPage;
import com.previewstudio.orchestrator.service.PreviewTarget;
import com.previewstudio.orchestrator.service.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for PreviewController.
 *
 * @WebMvcTest starts only the web layer plus ApiExceptionHandler; the
 * orchestrator, the SSE stream and the queue are mocks.
 */
@WebMvcTest(PreviewController.class)
class PreviewControllerTest {

    static final String JOB_ID = "5f0c7a4e-1111-4222-8333-944455556666";

    @Autowired MockMvc mockMvc;

    @MockitoBean JobOrchestrator orchestrator;
    @MockitoBean JobEventStream  eventStream;
    @MockitoBean QueueService    queue;

    @TempDir Path tmp;

    // ------------------------------------------------------------------
    // POST /api/preview/start
    // ------------------------------------------------------------------

    @Test
    void start_validRequest_returns201WithLinks() throws Exception {
        when(orchestrator.createJob(any())).thenReturn(JOB_ID);

        mockMvc.perform(post("/api/preview/start")
                        .contentType(org.springframework.http.MediaType.APPLICATION_JSON)
                        .content("""
                                {"configYaml":"libraries: {}","testOptions":{"selectedTargets":["matrix"]}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(JOB_ID))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.eventsUrl").value("/api/preview/events/" + JOB_ID))
                .andExpect(jsonPath("$.statusUrl").value("/api/preview/status/" + JOB_ID));
    }

    @Test
    void start_missingYaml_returns400() throws Exception {
        when(orchestrator.createJob(any())).thenThrow(new ValidationException("configYaml is required"));

        mockMvc.perform(post("/api/preview/start")
                        .contentType(org.springframework.http.MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request"))
                .andExpect(jsonPath("$.details").value("configYaml is required"));
    }

    @Test
    void start_unknownField_returns400WithoutCreatingJob() throws Exception {
        mockMvc.perform(post("/api/preview/start")
                        .contentType(org.springframework.http.MediaType.APPLICATION_JSON)
                        .content("""
                                {"configYaml":"libraries: {}","priority":9}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request body"));

        verify(orchestrator, never()).createJob(any());
    }

    // ------------------------------------------------------------------
    // GET /api/preview/status/{id}
    // ------------------------------------------------------------------

    @Test
    void status_existingJob_returnsLowerCaseStatus() throws Exception {
        when(orchestrator.getJobMeta(JOB_ID)).thenReturn(job(JobStatus.RUNNING, 50));

        mockMvc.perform(get("/api/preview/status/{id}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value(JOB_ID))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.progress").value(50));
    }

    @Test
    void status_unknownJob_returns404() throws Exception {
        when(orchestrator.getJobMeta("missing")).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/preview/status/{id}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Job not found"))
                .andExpect(jsonPath("$.details").value("missing"));
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    @Test
    void cancel_running_returnsSuccess() throws Exception {
        when(orchestrator.cancelJob(JOB_ID)).thenReturn(true);

        mockMvc.perform(post("/api/preview/cancel/{id}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    void cancel_notAllowed_returns409() throws Exception {
        when(orchestrator.cancelJob(JOB_ID)).thenReturn(false);

        mockMvc.perform(post("/api/preview/cancel/{id}", JOB_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Operation not allowed"));
    }

    @Test
    void forceFail_finishedJob_returns409() throws Exception {
        when(orchestrator.forceFailJob(JOB_ID)).thenReturn(false);

        mockMvc.perform(delete("/api/preview/force/{id}", JOB_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details").value("Job has already finished"));
    }

    @Test
    void retry_failedJob_returnsPending() throws Exception {
        when(orchestrator.retryJob(JOB_ID)).thenReturn(true);

        mockMvc.perform(post("/api/preview/retry/{id}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    void pauseQueue_returnsStats() throws Exception {
        when(queue.stats()).thenReturn(new QueueStats("preview-render", 2, 1, 5, 0, true));

        mockMvc.perform(post("/api/preview/queue/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));

        verify(queue).pause();
    }

    // ------------------------------------------------------------------
    // Listings
    // ------------------------------------------------------------------

    @Test
    void active_noJob_returnsFalse() throws Exception {
        when(orchestrator.getActiveJob()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/preview/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasActiveJob").value(false))
                .andExpect(jsonPath("$.job").doesNotExist());
    }

    @Test
    void jobs_defaultsAndPagination() throws Exception {
        JobPage page = JobPage.of(List.of(job(JobStatus.COMPLETED, 100), job(JobStatus.FAILED, 30)), 1, 20);
        when(orchestrator.listJobs(1, 20, null)).thenReturn(page);

        mockMvc.perform(get("/api/preview/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobs.length()").value(2))
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.limit").value(20))
                .andExpect(jsonPath("$.pagination.total").value(2))
                .andExpect(jsonPath("$.pagination.totalPages").value(1))
                .andExpect(jsonPath("$.pagination.hasNextPage").value(false));
    }

    @Test
    void jobs_statusFilter_isParsed() throws Exception {
        when(orchestrator.listJobs(2, 5, JobStatus.FAILED)).thenReturn(JobPage.of(List.of(), 2, 5));

        mockMvc.perform(get("/api/preview/jobs").param("page", "2").param("limit", "5").param("status", "failed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.hasPrevPage").value(true));
    }

    @Test
    void jobs_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/api/preview/jobs").param("status", "exploded"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Unknown job status: exploded"));

        verify(orchestrator, never()).listJobs(anyInt(), anyInt(), any());
    }

    @Test
    void targets_includeDisplayType() throws Exception {
        when(orchestrator.availableTargets()).thenReturn(List.of(
                new PreviewTarget("matrix", "The Matrix (1999) - Movie", MediaType.MOVIE, "The Matrix", 1999, null, null),
                new PreviewTarget("bb_s01e01", "Pilot - Episode", MediaType.EPISODE, "Breaking Bad", null, 1, 1)));

        mockMvc.perform(get("/api/preview/targets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targets[0].displayType").value("Movie"))
                .andExpect(jsonPath("$.targets[1].type").value("episode"))
                .andExpect(jsonPath("$.targets[1].displayType").value("S01E01"));
    }

    // ------------------------------------------------------------------
    // Images and logs
    // ------------------------------------------------------------------

    @Test
    void image_unknownFolder_returns400() throws Exception {
        mockMvc.perform(get("/api/preview/image/{id}/{folder}/{file}", JOB_ID, "secrets", "matrix.jpg"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).getImagePath(any(), any(), any());
    }

    @Test
    void image_missingFile_returns404() throws Exception {
        when(orchestrator.getImagePath(JOB_ID, ImageFolder.OUTPUT, "matrix_after.png")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/preview/image/{id}/{folder}/{file}", JOB_ID, "output", "matrix_after.png"))
                .andExpect(status().isNotFound());
    }

    @Test
    void image_draft_isServedWithShortCache() throws Exception {
        Path draft = Files.write(tmp.resolve("matrix_draft.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        when(orchestrator.getImagePath(eq(JOB_ID), eq(ImageFolder.DRAFT), eq("matrix_draft.png")))
                .thenReturn(Optional.of(draft));

        mockMvc.perform(get("/api/preview/image/{id}/{folder}/{file}", JOB_ID, "draft", "matrix_draft.png"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andExpect(header().string("Cache-Control", "max-age=60"));
    }

    @Test
    void logs_missingFile_returns404() throws Exception {
        when(orchestrator.getLogPath(JOB_ID)).thenReturn(tmp.resolve("container.log"));

        mockMvc.perform(get("/api/preview/logs/{id}", JOB_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void logs_existingFile_isServedAsText() throws Exception {
        Path logFile = Files.writeString(tmp.resolve("container.log"), "Rendering overlays\n");
        when(orchestrator.getLogPath(JOB_ID)).thenReturn(logFile);

        mockMvc.perform(get("/api/preview/logs/{id}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(content().string("Rendering overlays\n"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Job job(JobStatus status, int progress) {
        Job job = new Job(JOB_ID, Instant.parse("2026-03-01T10:00:00Z"));
        job.setStatus(status);
        job.setProgress(progress);
        return job;
    }
}
