package com.previewstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of media item a preview target can be.
 */
public enum MediaType {
    MOVIE,
    SHOW,
    SEASON,
    EPISODE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MediaType of(String value) {
        for (MediaType type : values()) {
            if (type.value().equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown media type: " + value);
    }
}
