package com.previewstudio.orchestrator.model;

import java.util.List;

/**
 * One media item rendered as part of a Job.
 * Owned by its Job; targets are never shared between jobs.
 */
public record JobTarget(
        String        id,
        String        title,
        MediaType     type,
        ArtworkSource baseSource,
        List<String>  warnings
) {
    public JobTarget {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
