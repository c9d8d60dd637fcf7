package com.previewstudio.orchestrator.repository;

/**
 * Thrown when a job record cannot be written to disk.
 * The in-memory cache is left untouched when this is thrown.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
