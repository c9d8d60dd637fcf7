package com.previewstudio.orchestrator.api.dto;

/** Response body for GET /api/preview/active; {@code job} is null when nothing runs. */
public record ActiveJobResponse(boolean hasActiveJob, JobResponse job) {

    public static ActiveJobResponse none() {
        return new ActiveJobResponse(false, null);
    }
}
