package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.model.TestOptions;

import java.util.List;

/**
 * Chooses the media items a preview renders.
 */
public interface TargetResolver {

    /** Every target a user may select. */
    List<PreviewTarget> catalogue();

    /**
     * Targets selected by {@code options}, in catalogue order. Items that
     * cannot be matched are still returned, with warnings.
     */
    List<ResolvedTarget> resolve(TestOptions options);
}
