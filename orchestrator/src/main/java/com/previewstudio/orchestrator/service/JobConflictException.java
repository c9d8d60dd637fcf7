package com.previewstudio.orchestrator.service;

/**
 * Thrown when an operation is not allowed in the job's current status,
 * e.g. pausing a job that is not running.
 */
public class JobConflictException extends RuntimeException {

    public JobConflictException(String message) {
        super(message);
    }
}
