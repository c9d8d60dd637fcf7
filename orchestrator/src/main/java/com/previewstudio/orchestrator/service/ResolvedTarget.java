package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.MediaType;

import java.util.List;

/** A preview target matched to an actual media item. */
public record ResolvedTarget(PreviewTarget target, String title, List<String> warnings) {

    public ResolvedTarget {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String id() {
        return target.id();
    }

    public MediaType type() {
        return target.type();
    }
}
