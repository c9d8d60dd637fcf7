package com.previewstudio.orchestrator.runner;

import java.util.List;

/**
 * Command and environment handed to the renderer container.
 * The renderer reads everything else from the mounted job directory.
 */
public record RenderInputs(List<String> command, List<String> env) {

    public static final List<String> DEFAULT_COMMAND = List.of("--job", "/jobs");
    public static final List<String> DEFAULT_ENV     = List.of("PYTHONUNBUFFERED=1", "KOMETA_DOCKER=True");

    public RenderInputs {
        command = command == null || command.isEmpty() ? DEFAULT_COMMAND : List.copyOf(command);
        env     = env == null ? DEFAULT_ENV : List.copyOf(env);
    }

    public static RenderInputs defaults() {
        return new RenderInputs(null, null);
    }
}
