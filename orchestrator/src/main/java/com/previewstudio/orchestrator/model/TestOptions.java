package com.previewstudio.orchestrator.model;

import java.util.List;

/**
 * Narrows a preview run to specific targets, libraries and overlays.
 *
 * Every field is optional; missing values fall back to "everything":
 * an empty list means no filtering and a missing media type flag means
 * the type is included.
 */
public record TestOptions(
        List<String>     selectedTargets,
        MediaTypeFilters mediaTypes,
        List<String>     selectedLibraries,
        List<String>     selectedOverlays
) {
    public TestOptions {
        selectedTargets   = selectedTargets   == null ? List.of() : List.copyOf(selectedTargets);
        mediaTypes        = mediaTypes        == null ? MediaTypeFilters.all() : mediaTypes;
        selectedLibraries = selectedLibraries == null ? List.of() : List.copyOf(selectedLibraries);
        selectedOverlays  = selectedOverlays  == null ? List.of() : List.copyOf(selectedOverlays);
    }

    public static TestOptions defaults() {
        return new TestOptions(null, null, null, null);
    }

    /** Media type toggles. A null flag means "include". */
    public record MediaTypeFilters(Boolean movies, Boolean shows, Boolean seasons, Boolean episodes) {

        public MediaTypeFilters {
            movies   = movies   == null || movies;
            shows    = shows    == null || shows;
            seasons  = seasons  == null || seasons;
            episodes = episodes == null || episodes;
        }

        public static MediaTypeFilters all() {
            return new MediaTypeFilters(true, true, true, true);
        }

        public boolean includes(MediaType type) {
            return switch (type) {
                case MOVIE   -> movies;
                case SHOW    -> shows;
                case SEASON  -> seasons;
                case EPISODE -> episodes;
            };
        }
    }
}
