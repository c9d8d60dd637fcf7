package com.previewstudio.orchestrator.queue;

/**
 * Lifecycle callbacks of queue entries. All methods default to no-ops.
 *
 * Callbacks run on the thread that caused the transition (dispatcher,
 * worker or stall checker). A listener that throws is logged and skipped.
 */
public interface QueueEventListener {

    /** Entry claimed by the worker; {@code attempt} starts at 1. */
    default void onActive(String jobId, int attempt) {}

    default void onProgress(String jobId, int progress) {}

    default void onCompleted(String jobId, JobResult result) {}

    /** {@code willRetry} is true when the entry went back to WAITING with a backoff. */
    default void onFailed(String jobId, String reason, boolean willRetry) {}

    /** Lock expired while ACTIVE. Followed by a re-dispatch or an onFailed. */
    default void onStalled(String jobId) {}
}
