package com.previewstudio.orchestrator.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something that happened to a job: a renderer log line, a progress step,
 * or the terminal outcome.
 *
 * {@code data} carries optional structured fields: progress, exitCode,
 * paused, status, error.
 */
public record JobEvent(JobEventType type, Instant timestamp, String message, Map<String, Object> data) {

    public JobEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static JobEvent log(String message) {
        return new JobEvent(JobEventType.LOG, Instant.now(), message, Map.of());
    }

    public static JobEvent log(String message, Map<String, Object> data) {
        return new JobEvent(JobEventType.LOG, Instant.now(), message, data);
    }

    public static JobEvent progress(int progress, String message) {
        return new JobEvent(JobEventType.PROGRESS, Instant.now(), message, Map.of("progress", progress));
    }

    public static JobEvent progress(String message, Map<String, Object> data) {
        return new JobEvent(JobEventType.PROGRESS, Instant.now(), message, data);
    }

    public static JobEvent complete(int exitCode) {
        return new JobEvent(JobEventType.COMPLETE, Instant.now(), "Renderer finished successfully",
                Map.of("exitCode", exitCode, "progress", 100));
    }

    public static JobEvent error(String message) {
        return new JobEvent(JobEventType.ERROR, Instant.now(), message, Map.of("error", message));
    }

    public static JobEvent error(String message, Integer exitCode) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", message);
        if (exitCode != null) {
            data.put("exitCode", exitCode);
            data.put("progress", 100);
        }
        return new JobEvent(JobEventType.ERROR, Instant.now(), message, data);
    }

    // ------------------------------------------------------------------
    // Typed accessors for the optional data fields
    // ------------------------------------------------------------------

    public Integer progressValue() {
        return intValue("progress");
    }

    public Integer exitCode() {
        return intValue("exitCode");
    }

    public String status() {
        Object v = data.get("status");
        return v == null ? null : v.toString();
    }

    private Integer intValue(String key) {
        Object v = data.get(key);
        return v instanceof Number ? ((Number) v).intValue() : null;
    }
}
