package com.previewstudio.orchestrator.artifact;

import java.util.Arrays;
import java.util.Optional;

/** Image folders exposed through the image endpoint. */
public enum ImageFolder {
    INPUT,
    OUTPUT,
    DRAFT;

    public String value() {
        return name().toLowerCase();
    }

    public static Optional<ImageFolder> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(f -> f.value().equals(value))
                .findFirst();
    }
}
