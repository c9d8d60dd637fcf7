package com.previewstudio.orchestrator.model;

/**
 * State of a durable queue entry.
 *
 * Transitions:
 *   WAITING → ACTIVE     (claimed by the worker)
 *   ACTIVE  → COMPLETED  (processor returned)
 *   ACTIVE  → FAILED     (processor threw, attempts exhausted, or stalled too often)
 *   ACTIVE  → WAITING    (failed or stalled with attempts left, after backoff)
 *   FAILED  → WAITING    (manual retry)
 */
public enum QueueEntryState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
