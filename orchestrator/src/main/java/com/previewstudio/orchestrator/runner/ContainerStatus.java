package com.previewstudio.orchestrator.runner;

import com.fasterxml.jackson.annotation.JsonValue;

/** Status of the renderer container tracked for a job. */
public enum ContainerStatus {
    RUNNING,
    STOPPED,
    NOT_FOUND;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
