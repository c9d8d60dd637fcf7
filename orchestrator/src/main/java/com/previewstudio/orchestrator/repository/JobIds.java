package com.previewstudio.orchestrator.repository;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Job id generation and validation.
 *
 * Ids come back in URLs and are used as directory names, so anything that
 * is not a single plain path segment is rejected.
 */
public final class JobIds {

    private JobIds() {}

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String jobId) {
        if (jobId == null || jobId.isBlank() || ".".equals(jobId) || "..".equals(jobId)) return false;
        try {
            Path name = Path.of(jobId).getFileName();
            return name != null && name.toString().equals(jobId) && !jobId.contains("\\");
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
