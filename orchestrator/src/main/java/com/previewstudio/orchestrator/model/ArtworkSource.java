package com.previewstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the base ("before") artwork of a target came from.
 *
 * PLEX_CURRENT is the last resort: the media server's current poster may
 * already carry overlays from an earlier run.
 */
public enum ArtworkSource {
    ASSET_DIRECTORY,
    ORIGINAL_POSTER,
    PLEX_CURRENT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ArtworkSource of(String value) {
        for (ArtworkSource source : values()) {
            if (source.value().equalsIgnoreCase(value)) return source;
        }
        throw new IllegalArgumentException("Unknown artwork source: " + value);
    }
}
