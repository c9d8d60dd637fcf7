package com.previewstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle of a preview Job.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED | FAILED | CANCELLED
 *   RUNNING ↔ PAUSED
 *   PAUSED  → CANCELLED | FAILED
 *
 * Two paths bypass {@link #canTransitionTo}: force-fail (any non-terminal
 * state → FAILED) and manual retry (FAILED → PENDING).
 *
 * Serialized in lower case ("pending", "running", ...) in job-meta.json
 * and in API responses.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Running or paused: the job currently owns the renderer. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Whether a normal (non-administrative) update may move a job from this
     * status to {@code next}. RUNNING → RUNNING and PAUSED → PAUSED are allowed
     * so progress can be recorded without a status change.
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING   -> next == RUNNING;
            case RUNNING   -> next == RUNNING || next == PAUSED || next.isTerminal();
            case PAUSED    -> next == PAUSED || next == RUNNING || next == CANCELLED || next == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobStatus of(String value) {
        return fromValue(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown job status: " + value));
    }

    public static Optional<JobStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.value().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
