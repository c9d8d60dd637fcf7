package com.previewstudio.orchestrator.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Places the base ("before") image of each target into a job's input
 * directory as {@code {targetId}.jpg}.
 */
public interface ArtworkStager {

    /** One result per target, in the same order. */
    List<StagedArtwork> stage(String jobId, List<ResolvedTarget> targets, Path inputDir);
}
