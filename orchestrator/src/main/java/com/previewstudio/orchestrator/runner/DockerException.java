package com.previewstudio.orchestrator.runner;

/**
 * Thrown when the Docker Engine API returns an error or is unreachable.
 */
public class DockerException extends RuntimeException {

    private final int statusCode;

    public DockerException(String message) {
        this(message, -1);
    }

    public DockerException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DockerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status from the daemon, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
