package com.previewstudio.orchestrator.runner;

/**
 * Outcome of one container run.
 *
 * @param exitCode  container exit status
 * @param logs      full demultiplexed output
 * @param cancelled true when the run was stopped through {@link ContainerRunner#cancel};
 *                  no complete/error event was emitted in that case
 */
public record RunResult(int exitCode, String logs, boolean cancelled) {

    public boolean succeeded() {
        return !cancelled && exitCode == 0;
    }
}
