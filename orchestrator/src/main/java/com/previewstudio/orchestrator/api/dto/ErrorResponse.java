package com.previewstudio.orchestrator.api.dto;

/** Error body returned by ApiExceptionHandler. */
public record ErrorResponse(String error, String details) {}
