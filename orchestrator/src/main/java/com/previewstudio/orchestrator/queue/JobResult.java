package com.previewstudio.orchestrator.queue;

/** Return value of a processed entry, stored as JSON on the entry. */
public record JobResult(int exitCode, boolean cancelled) {

    public static JobResult success() {
        return new JobResult(0, false);
    }

    public static JobResult cancelledRun(int exitCode) {
        return new JobResult(exitCode, true);
    }
}
