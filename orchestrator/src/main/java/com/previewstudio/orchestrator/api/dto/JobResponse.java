package com.previewstudio.orchestrator.api.dto;

import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobTarget;

import java.time.Instant;
import java.util.List;

/**
 * Response body for GET /api/preview/status/{id} and the job listing.
 */
public record JobResponse(
        String          jobId,
        String          status,
        int             progress,
        Instant         createdAt,
        Instant         updatedAt,
        Instant         completedAt,
        Integer         exitCode,
        String          error,
        List<JobTarget> targets,
        List<String>    warnings
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getJobId(),
                job.getStatus().value(),
                job.getProgress(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt(),
                job.getExitCode(),
                job.getError(),
                job.getTargets(),
                job.getWarnings()
        );
    }
}
