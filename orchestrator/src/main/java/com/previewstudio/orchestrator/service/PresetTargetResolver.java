package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.MediaType;
import com.previewstudio.orchestrator.model.TestOptions;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed catalogue of well-known titles covering every media type, so a
 * preview shows movie, show, season and episode overlays side by side.
 */
@Component
public class PresetTargetResolver implements TargetResolver {

    static final List<PreviewTarget> PRESETS = List.of(
            new PreviewTarget("matrix",             "The Matrix (1999) - Movie",  MediaType.MOVIE,   "The Matrix",   1999, null, null),
            new PreviewTarget("dune",               "Dune (2021) - Movie",        MediaType.MOVIE,   "Dune",         2021, null, null),
            new PreviewTarget("breakingbad_series", "Breaking Bad - Series",      MediaType.SHOW,    "Breaking Bad", null, null, null),
            new PreviewTarget("breakingbad_s01",    "Breaking Bad - Season 1",    MediaType.SEASON,  "Breaking Bad", null, 1,    null),
            new PreviewTarget("breakingbad_s01e01", "Breaking Bad - S01E01",      MediaType.EPISODE, "Breaking Bad", null, 1,    1)
    );

    @Override
    public List<PreviewTarget> catalogue() {
        return PRESETS;
    }

    @Override
    public List<ResolvedTarget> resolve(TestOptions options) {
        List<String> selected = options.selectedTargets();
        return PRESETS.stream()
                .filter(t -> selected.isEmpty() || selected.contains(t.id()))
                .filter(t -> options.mediaTypes().includes(t.type()))
                .map(t -> new ResolvedTarget(t, titleOf(t), List.of()))
                .toList();
    }

    private static String titleOf(PreviewTarget t) {
        return switch (t.type()) {
            case MOVIE, SHOW -> t.searchTitle();
            case SEASON      -> "Season " + t.seasonIndex();
            case EPISODE     -> String.format("S%02dE%02d", t.seasonIndex(), t.episodeIndex());
        };
    }
}
