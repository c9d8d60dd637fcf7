package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.MediaType;

/**
 * A media item that can be previewed, as offered to the user.
 *
 * seasonIndex and episodeIndex are only set for seasons and episodes;
 * year only for movies.
 */
public record PreviewTarget(
        String    id,
        String    label,
        MediaType type,
        String    searchTitle,
        Integer   year,
        Integer   seasonIndex,
        Integer   episodeIndex
) {}
