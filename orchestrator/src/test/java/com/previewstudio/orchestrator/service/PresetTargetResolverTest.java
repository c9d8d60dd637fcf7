package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.MediaType;
import com.previewstudio.orchestrator.model.TestOptions;
import com.previewstudio.orchestrator.model.TestOptions.MediaTypeFilters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PresetTargetResolverTest {

    PresetTargetResolver resolver = new PresetTargetResolver();

    @Test
    void resolve_noOptions_returnsWholeCatalogue() {
        List<ResolvedTarget> targets = resolver.resolve(TestOptions.defaults());

        assertThat(targets).extracting(ResolvedTarget::id).containsExactly(
                "matrix", "dune", "breakingbad_series", "breakingbad_s01", "breakingbad_s01e01");
    }

    @Test
    void resolve_selectedTargets_keepsCatalogueOrder() {
        TestOptions options = new TestOptions(List.of("dune", "matrix"), null, null, null);

        assertThat(resolver.resolve(options)).extracting(ResolvedTarget::id).containsExactly("matrix", "dune");
    }

    @Test
    void resolve_mediaTypeFilter_appliesAfterSelection() {
        TestOptions options = new TestOptions(
                List.of("matrix", "breakingbad_s01"),
                new MediaTypeFilters(false, null, null, null),
                null, null);

        assertThat(resolver.resolve(options)).extracting(ResolvedTarget::id).containsExactly("breakingbad_s01");
    }

    @Test
    void resolve_everyTypeDisabled_returnsNothing() {
        TestOptions options = new TestOptions(null, new MediaTypeFilters(false, false, false, false), null, null);
        assertThat(resolver.resolve(options)).isEmpty();
    }

    @Test
    void resolve_titlesDependOnType() {
        List<ResolvedTarget> targets = resolver.resolve(TestOptions.defaults());

        assertThat(targets).extracting(ResolvedTarget::title).containsExactly(
                "The Matrix", "Dune", "Breaking Bad", "Season 1", "S01E01");
        assertThat(targets.get(4).type()).isEqualTo(MediaType.EPISODE);
    }
}
