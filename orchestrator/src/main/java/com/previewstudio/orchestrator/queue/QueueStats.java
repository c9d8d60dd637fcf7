package com.previewstudio.orchestrator.queue;

/** Entry counts per state, plus whether dispatching is paused. */
public record QueueStats(String name, long waiting, long active, long completed, long failed, boolean paused) {}
