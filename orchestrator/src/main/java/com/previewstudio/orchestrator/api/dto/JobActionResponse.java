package com.previewstudio.orchestrator.api.dto;

/**
 * Response body for cancel, force, pause, resume and retry.
 * {@code status} is the status the job was moved to.
 */
public record JobActionResponse(boolean success, String jobId, String status, String message) {

    public static JobActionResponse ok(String jobId, String status, String message) {
        return new JobActionResponse(true, jobId, status, message);
    }
}
