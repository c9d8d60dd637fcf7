package com.previewstudio.orchestrator.event;

/** Receives events for one job, or for every job when registered globally. */
@FunctionalInterface
public interface JobEventHandler {

    void onEvent(String jobId, JobEvent event);
}
