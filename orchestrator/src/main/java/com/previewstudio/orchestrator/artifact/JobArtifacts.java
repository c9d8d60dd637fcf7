package com.previewstudio.orchestrator.artifact;

import com.previewstudio.orchestrator.model.ArtworkSource;
import com.previewstudio.orchestrator.model.MediaType;

import java.util.List;

/**
 * Before/after image URLs for every target of a job. Computed on demand,
 * never persisted.
 */
public record JobArtifacts(String jobId, List<Item> items) {

    public JobArtifacts {
        items = List.copyOf(items);
    }

    /**
     * afterUrl and draftUrl are null until the renderer has written the file.
     */
    public record Item(
            String        id,
            String        title,
            MediaType     type,
            String        beforeUrl,
            String        afterUrl,
            String        draftUrl,
            ArtworkSource baseSource,
            List<String>  warnings
    ) {}
}
