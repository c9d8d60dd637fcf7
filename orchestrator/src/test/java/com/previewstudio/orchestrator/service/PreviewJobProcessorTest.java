package com.previewstudio.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.event.JobEventBus;
import com.previewstudio.orchestrator.model.ArtworkSource;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.model.PreviewRequest;
import com.previewstudio.orchestrator.model.TestOptions;
import com.previewstudio.orchestrator.queue.JobResult;
import com.previewstudio.orchestrator.queue.QueuedJob;
import com.previewstudio.orchestrator.repository.JobPaths;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.runner.ContainerRunner;
import com.previewstudio.orchestrator.runner.RenderExecutionException;
import com.previewstudio.orchestrator.runner.RunResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PreviewJobProcessorTest {

    static final String JOB_ID = "job-1";
    static final String YAML   = "libraries:\n  Movies:\n    overlay_files:\n      - default: resolution\n";

    @TempDir Path jobsRoot;

    @Mock JobRecordStore  store;
    @Mock ArtworkStager   stager;
    @Mock ContainerRunner runner;

    ObjectMapper        json = new ObjectMapper();
    JobPaths            paths;
    PreviewJobProcessor processor;

    final List<Integer> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        paths = new JobPaths(jobsRoot);
        processor = new PreviewJobProcessor(store, paths, new JobEventBus(),
                new PresetTargetResolver(), stager, runner, json);
    }

    @Test
    void process_twoTargets_writesInputsAndRuns() throws Exception {
        givenJob(JobStatus.RUNNING);
        stageAll();
        when(runner.run(eq(JOB_ID), any())).thenReturn(new RunResult(0, "", false));

        JobResult result = processor.process(queued(request(List.of("matrix", "dune"))));

        assertThat(result).isEqualTo(JobResult.success());
        assertThat(progress).containsExactly(15, 30, 45, 50);
        assertThat(Files.readString(paths.configDir(JOB_ID).resolve("preview.yml"))).isEqualTo(YAML);

        JsonNode meta = json.readTree(paths.rendererMetaFile(JOB_ID).toFile());
        assertThat(meta.get("jobId").asText()).isEqualTo(JOB_ID);
        assertThat(meta.get("profileId").asText()).isEqualTo("profile-7");
        assertThat(meta.get("items").get("matrix").get("resolution").asText()).isEqualTo("1080p");
        assertThat(meta.get("items").get("dune").get("hdr").asBoolean()).isTrue();
        assertThat(meta.get("items").get("dune").get("baseSource").asText()).isEqualTo("asset_directory");
        verify(store).update(eq(JOB_ID), any());
    }

    @Test
    void process_episodeTarget_carriesSeasonAndEpisodeIndex() throws Exception {
        givenJob(JobStatus.RUNNING);
        stageAll();
        when(runner.run(eq(JOB_ID), any())).thenReturn(new RunResult(0, "", false));

        processor.process(queued(request(List.of("breakingbad_s01e01"))));

        JsonNode item = json.readTree(paths.rendererMetaFile(JOB_ID).toFile()).get("items").get("breakingbad_s01e01");
        assertThat(item.get("season_index").asInt()).isEqualTo(1);
        assertThat(item.get("episode_index").asInt()).isEqualTo(1);
        assertThat(item.get("title").asText()).isEqualTo("S01E01");
    }

    @Test
    void process_noTargetsSelected_fails() {
        givenJob(JobStatus.RUNNING);
        PreviewRequest req = new PreviewRequest(YAML, null,
                new TestOptions(null, new TestOptions.MediaTypeFilters(false, false, false, false), null, null));

        assertThatThrownBy(() -> processor.process(queued(req)))
                .isInstanceOf(RenderExecutionException.class)
                .hasMessageStartingWith("No targets selected for preview");
        verifyNoInteractions(runner);
    }

    @Test
    void process_noArtworkAnywhere_fails() {
        givenJob(JobStatus.RUNNING);
        when(stager.stage(eq(JOB_ID), anyList(), any())).thenReturn(List.of(
                new StagedArtwork("matrix", null, List.of("No artwork found for matrix"))));

        assertThatThrownBy(() -> processor.process(queued(request(List.of("matrix")))))
                .isInstanceOf(RenderExecutionException.class);
        verifyNoInteractions(runner);
    }

    @Test
    void process_rendererExitsNonZero_failsWithExitCode() throws Exception {
        givenJob(JobStatus.RUNNING);
        stageAll();
        when(runner.run(eq(JOB_ID), any())).thenReturn(new RunResult(1, "boom", false));

        assertThatThrownBy(() -> processor.process(queued(request(List.of("matrix")))))
                .isInstanceOf(RenderExecutionException.class)
                .hasMessage("Renderer exited with code 1")
                .extracting(e -> ((RenderExecutionException) e).getExitCode())
                .isEqualTo(1);
    }

    @Test
    void process_cancelledRender_isCancelledResult() throws Exception {
        givenJob(JobStatus.RUNNING);
        stageAll();
        when(runner.run(eq(JOB_ID), any())).thenReturn(new RunResult(137, "", true));

        assertThat(processor.process(queued(request(List.of("matrix"))))).isEqualTo(JobResult.cancelledRun(137));
    }

    @Test
    void process_jobAlreadyFinished_isSkipped() throws Exception {
        givenJob(JobStatus.FAILED);

        JobResult result = processor.process(queued(request(List.of("matrix"))));

        assertThat(result.cancelled()).isTrue();
        verifyNoInteractions(stager, runner);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void givenJob(JobStatus status) {
        Job job = new Job(JOB_ID, Instant.now());
        job.setStatus(status);
        when(store.get(JOB_ID)).thenReturn(Optional.of(job));
    }

    private void stageAll() {
        when(stager.stage(eq(JOB_ID), anyList(), any())).thenAnswer(inv -> {
            List<ResolvedTarget> targets = inv.getArgument(1);
            return targets.stream()
                    .map(t -> new StagedArtwork(t.id(), ArtworkSource.ASSET_DIRECTORY, List.of()))
                    .toList();
        });
    }

    private PreviewRequest request(List<String> targets) {
        return new PreviewRequest(YAML, "profile-7", new TestOptions(targets, null, null, null));
    }

    private QueuedJob queued(PreviewRequest request) throws Exception {
        return new QueuedJob(JOB_ID, json.writeValueAsString(request), 1, progress::add);
    }
}
