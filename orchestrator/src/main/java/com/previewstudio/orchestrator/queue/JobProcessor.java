package com.previewstudio.orchestrator.queue;

/**
 * The processing function bound to the queue with {@link QueueService#initialize}.
 *
 * Returning normally completes the entry; throwing fails it (and may
 * schedule a retry, depending on the entry's attempts).
 */
@FunctionalInterface
public interface JobProcessor {

    JobResult process(QueuedJob job);
}
