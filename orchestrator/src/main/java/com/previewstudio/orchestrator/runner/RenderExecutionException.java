package com.previewstudio.orchestrator.runner;

/**
 * A render attempt failed for good: image unavailable, container could not
 * be created, or the renderer exited non-zero. The job is marked failed
 * with this message.
 */
public class RenderExecutionException extends RuntimeException {

    private final Integer exitCode;

    public RenderExecutionException(String message) {
        super(message);
        this.exitCode = null;
    }

    public RenderExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    public RenderExecutionException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    /** Renderer exit code, or null when the container never ran to completion. */
    public Integer getExitCode() {
        return exitCode;
    }
}
