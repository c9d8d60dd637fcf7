package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.Job;

import java.util.List;

/** One page of the job listing, newest first. Pages are 1-based. */
public record JobPage(
        List<Job> jobs,
        int       page,
        int       limit,
        int       total,
        int       totalPages,
        boolean   hasNextPage,
        boolean   hasPrevPage
) {
    public static JobPage of(List<Job> all, int page, int limit) {
        int total      = all.size();
        int totalPages = (total + limit - 1) / limit;
        int from       = Math.min((page - 1) * limit, total);
        int to         = Math.min(from + limit, total);
        return new JobPage(List.copyOf(all.subList(from, to)), page, limit, total, totalPages,
                page < totalPages, page > 1);
    }
}
