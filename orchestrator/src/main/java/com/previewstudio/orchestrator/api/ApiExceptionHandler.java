package com.previewstudio.orchestrator.api;

import com.previewstudio.orchestrator.api.dto.ErrorResponse;
import com.previewstudio.orchestrator.repository.JobStoreException;
import com.previewstudio.orchestrator.service.JobConflictException;
import com.previewstudio.orchestrator.service.JobNotFoundException;
import com.previewstudio.orchestrator.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the orchestrator's exceptions to HTTP responses with an
 * {@code {error, details}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    // Malformed JSON and unknown fields in the request body.
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        String details = e.getMostSpecificCause().getMessage();
        log.warn("Unreadable request body: {}", details);
        return body(HttpStatus.BAD_REQUEST, "Invalid request body", details);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "Job not found", e.getJobId());
    }

    @ExceptionHandler(JobConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(JobConflictException e) {
        return body(HttpStatus.CONFLICT, "Operation not allowed", e.getMessage());
    }

    @ExceptionHandler(JobStoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(JobStoreException e) {
        log.error("Job storage failure: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Job storage failure", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String details) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, details));
    }
}
