package com.previewstudio.orchestrator.api.dto;

import com.previewstudio.orchestrator.service.PreviewTarget;

import java.util.List;

/** Selectable preview targets, for GET /api/preview/targets. */
public record TargetResponse(List<Target> targets) {

    public record Target(String id, String label, String type, String displayType) {}

    public static TargetResponse from(List<PreviewTarget> catalogue) {
        return new TargetResponse(catalogue.stream()
                .map(t -> new Target(t.id(), t.label(), t.type().value(), displayType(t)))
                .toList());
    }

    private static String displayType(PreviewTarget target) {
        return switch (target.type()) {
            case MOVIE   -> "Movie";
            case SHOW    -> "Show";
            case SEASON  -> "Season " + (target.seasonIndex() != null ? target.seasonIndex() : 1);
            case EPISODE -> String.format("S%02dE%02d",
                    target.seasonIndex()  != null ? target.seasonIndex()  : 1,
                    target.episodeIndex() != null ? target.episodeIndex() : 1);
        };
    }
}
