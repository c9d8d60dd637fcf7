package com.previewstudio.orchestrator.event;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of a job event; also the SSE event name. */
public enum JobEventType {
    LOG,
    PROGRESS,
    ERROR,
    COMPLETE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == ERROR || this == COMPLETE;
    }
}
