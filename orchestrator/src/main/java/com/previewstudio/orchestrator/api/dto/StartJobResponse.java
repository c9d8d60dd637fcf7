package com.previewstudio.orchestrator.api.dto;

/** Response body for POST /api/preview/start. */
public record StartJobResponse(String jobId, String status, String message, String eventsUrl, String statusUrl) {

    public static StartJobResponse created(String jobId, String status) {
        return new StartJobResponse(jobId, status, "Preview job created",
                "/api/preview/events/" + jobId,
                "/api/preview/status/" + jobId);
    }
}
