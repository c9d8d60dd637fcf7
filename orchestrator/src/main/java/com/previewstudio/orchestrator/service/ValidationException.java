package com.previewstudio.orchestrator.service;

/**
 * Thrown when a submission is rejected before any job record is created.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
