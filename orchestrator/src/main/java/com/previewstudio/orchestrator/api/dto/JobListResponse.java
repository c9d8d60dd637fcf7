package com.previewstudio.orchestrator.api.dto;

import com.previewstudio.orchestrator.service.JobPage;

import java.util.List;

/**
 * Response body for GET /api/preview/jobs.
 */
public record JobListResponse(List<JobResponse> jobs, Pagination pagination) {

    public record Pagination(int page, int limit, int total, int totalPages,
                             boolean hasNextPage, boolean hasPrevPage) {}

    public static JobListResponse from(JobPage page) {
        return new JobListResponse(
                page.jobs().stream().map(JobResponse::from).toList(),
                new Pagination(page.page(), page.limit(), page.total(), page.totalPages(),
                        page.hasNextPage(), page.hasPrevPage()));
    }
}
