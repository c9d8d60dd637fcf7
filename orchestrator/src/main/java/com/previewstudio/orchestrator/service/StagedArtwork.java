package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.ArtworkSource;

import java.util.List;

/**
 * Result of staging the base image of one target.
 *
 * @param source null when no artwork was found; the target then has no
 *               input image and is skipped by the renderer
 */
public record StagedArtwork(String targetId, ArtworkSource source, List<String> warnings) {

    public StagedArtwork {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean staged() {
        return source != null;
    }
}
