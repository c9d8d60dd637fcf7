package com.previewstudio.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.event.JobEvent;
import com.previewstudio.orchestrator.event.JobEventBus;
import com.previewstudio.orchestrator.model.ArtworkSource;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobTarget;
import com.previewstudio.orchestrator.model.PreviewRequest;
import com.previewstudio.orchestrator.queue.JobProcessor;
import com.previewstudio.orchestrator.queue.JobResult;
import com.previewstudio.orchestrator.queue.QueuedJob;
import com.previewstudio.orchestrator.repository.JobPaths;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.runner.ContainerRunner;
import com.previewstudio.orchestrator.runner.RenderExecutionException;
import com.previewstudio.orchestrator.runner.RenderInputs;
import com.previewstudio.orchestrator.runner.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The queue's processing function: turns one queued PreviewRequest into a
 * renderer run.
 *
 * Progress milestones:
 *   15  targets resolved
 *   30  artwork staged, targets recorded on the job
 *   45  config/preview.yml and meta.json written
 *   50  renderer started (the runner reports the rest)
 *
 * Throwing fails the queue entry; JobOrchestrator then marks the job failed.
 */
@Component
public class PreviewJobProcessor implements JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreviewJobProcessor.class);

    private final JobRecordStore  store;
    private final JobPaths        paths;
    private final JobEventBus     events;
    private final TargetResolver  targetResolver;
    private final ArtworkStager   artworkStager;
    private final ContainerRunner runner;
    private final ObjectMapper    json;

    public PreviewJobProcessor(JobRecordStore store,
                               JobPaths paths,
                               JobEventBus events,
                               TargetResolver targetResolver,
                               ArtworkStager artworkStager,
                               ContainerRunner runner,
                               ObjectMapper objectMapper) {
        this.store          = store;
        this.paths          = paths;
        this.events         = events;
        this.targetResolver = targetResolver;
        this.artworkStager  = artworkStager;
        this.runner         = runner;
        this.json           = objectMapper;
    }

    @Override
    public JobResult process(QueuedJob queued) {
        String jobId = queued.jobId();

        // Force-failed or cancelled while it was still waiting.
        Optional<Job> current = store.get(jobId);
        if (current.isEmpty() || current.get().getStatus().isTerminal()) {
            log.info("Job {} is no longer runnable ({}), skipping", jobId,
                    current.map(j -> j.getStatus().value()).orElse("missing"));
            return JobResult.cancelledRun(-1);
        }

        PreviewRequest request = readRequest(queued.payload());

        step(queued, 15, "Resolving preview targets...");
        List<ResolvedTarget> targets = targetResolver.resolve(request.testOptions());
        if (targets.isEmpty()) {
            throw new RenderExecutionException(
                    "No targets selected for preview. Please select at least one target or media type.");
        }
        events.emit(jobId, JobEvent.log("Resolved " + targets.size() + " target(s) for preview"));

        step(queued, 30, "Fetching artwork...");
        List<StagedArtwork> artwork = artworkStager.stage(jobId, targets, paths.inputDir(jobId));
        List<JobTarget> jobTargets = toJobTargets(targets, artwork);
        store.update(jobId, job -> job.setTargets(jobTargets));
        for (StagedArtwork staged : artwork) {
            for (String warning : staged.warnings()) events.emit(jobId, JobEvent.log("Warning: " + warning));
        }
        if (artwork.stream().noneMatch(StagedArtwork::staged)) {
            throw new RenderExecutionException("No artwork could be staged for any selected target");
        }

        step(queued, 45, "Generating preview configuration...");
        writeRendererInputs(jobId, request, targets, artwork);

        step(queued, 50, "Starting renderer...");
        RunResult result = runner.run(jobId, RenderInputs.defaults());

        if (result.cancelled()) {
            log.info("Job {} render was cancelled", jobId);
            return JobResult.cancelledRun(result.exitCode());
        }
        if (result.exitCode() != 0) {
            throw new RenderExecutionException("Renderer exited with code " + result.exitCode(), result.exitCode());
        }
        return JobResult.success();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void step(QueuedJob queued, int progress, String message) {
        queued.updateProgress(progress);
        events.emit(queued.jobId(), JobEvent.progress(progress, message));
    }

    private PreviewRequest readRequest(String payload) {
        try {
            return json.readValue(payload, PreviewRequest.class);
        } catch (JsonProcessingException e) {
            throw new RenderExecutionException("Unreadable job payload: " + e.getOriginalMessage(), e);
        }
    }

    private static List<JobTarget> toJobTargets(List<ResolvedTarget> targets, List<StagedArtwork> artwork) {
        List<JobTarget> result = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            ResolvedTarget target = targets.get(i);
            StagedArtwork  staged = i < artwork.size() ? artwork.get(i) : null;

            List<String> warnings = new ArrayList<>(target.warnings());
            ArtworkSource source = null;
            if (staged != null) {
                warnings.addAll(staged.warnings());
                source = staged.source();
            }
            result.add(new JobTarget(target.id(), target.title(), target.type(), source, warnings));
        }
        return result;
    }

    /** config/preview.yml (the user's YAML) and meta.json (per-item metadata). */
    private void writeRendererInputs(String jobId, PreviewRequest request,
                                     List<ResolvedTarget> targets, List<StagedArtwork> artwork) {
        Map<String, Object> items = new LinkedHashMap<>();
        for (int i = 0; i < targets.size(); i++) {
            ResolvedTarget target = targets.get(i);
            StagedArtwork  staged = artwork.get(i);
            if (!staged.staged()) continue;

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type",       target.type().value());
            item.put("title",      target.title());
            item.put("baseSource", staged.source().value());
            item.putAll(itemMetadata(target.target()));
            items.put(target.id(), item);
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("jobId", jobId);
        if (request.profileId() != null) meta.put("profileId", request.profileId());
        meta.put("selectedLibraries", request.testOptions().selectedLibraries());
        meta.put("selectedOverlays",  request.testOptions().selectedOverlays());
        meta.put("items", items);

        try {
            Files.createDirectories(paths.configDir(jobId));
            Files.writeString(paths.configDir(jobId).resolve("preview.yml"), request.configYaml(), StandardCharsets.UTF_8);
            json.writerWithDefaultPrettyPrinter().writeValue(paths.rendererMetaFile(jobId).toFile(), meta);
        } catch (IOException e) {
            throw new RenderExecutionException("Failed to write renderer inputs: " + e.getMessage(), e);
        }
    }

    /** Type-specific fields the renderer uses to draw overlays. */
    private static Map<String, Object> itemMetadata(PreviewTarget target) {
        Map<String, Object> meta = new LinkedHashMap<>();
        switch (target.type()) {
            case MOVIE -> {
                if ("dune".equals(target.id())) {
                    meta.put("resolution",  "4K");
                    meta.put("audio_codec", "Atmos");
                    meta.put("hdr",         true);
                } else if ("matrix".equals(target.id())) {
                    meta.put("resolution",  "1080p");
                    meta.put("audio_codec", "DTS-HD");
                }
                meta.put("year", target.year());
            }
            case SHOW -> {
                meta.put("rating", "9.5");
                meta.put("status", "COMPLETED");
            }
            case SEASON -> meta.put("season_index", target.seasonIndex() != null ? target.seasonIndex() : 1);
            case EPISODE -> {
                meta.put("season_index",  target.seasonIndex()  != null ? target.seasonIndex()  : 1);
                meta.put("episode_index", target.episodeIndex() != null ? target.episodeIndex() : 1);
                meta.put("runtime", "58 min");
            }
        }
        return meta;
    }
}
