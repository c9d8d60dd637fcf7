package com.previewstudio.orchestrator.model;

/**
 * Raw input of a preview job: the user's renderer configuration plus
 * selection options.
 *
 * Serialized as JSON into the queue entry payload, so the worker sees
 * exactly what was submitted. Unknown fields are rejected at
 * deserialization time (spring.jackson.deserialization.fail-on-unknown-properties).
 *
 * profileId is informational only: it names the saved profile the YAML
 * came from and is echoed into the renderer's meta.json.
 */
public record PreviewRequest(String configYaml, String profileId, TestOptions testOptions) {

    // Compact constructor: missing options mean "preview everything".
    public PreviewRequest {
        if (testOptions == null) testOptions = TestOptions.defaults();
    }

    public PreviewRequest(String configYaml, TestOptions testOptions) {
        this(configYaml, null, testOptions);
    }
}
