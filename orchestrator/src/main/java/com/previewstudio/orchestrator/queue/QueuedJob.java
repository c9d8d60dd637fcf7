package com.previewstudio.orchestrator.queue;

import java.util.function.IntConsumer;

/**
 * A claimed queue entry as seen by the processing function.
 *
 * @param attempt 1 for the first run, incremented on every re-dispatch
 */
public record QueuedJob(String jobId, String payload, int attempt, IntConsumer progressSink) {

    /** Record progress on the queue entry; also raises a queue progress event. */
    public void updateProgress(int progress) {
        progressSink.accept(progress);
    }
}
