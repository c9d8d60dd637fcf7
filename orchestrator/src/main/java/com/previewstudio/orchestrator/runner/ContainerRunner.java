package com.previewstudio.orchestrator.runner;

import com.previewstudio.orchestrator.config.PreviewProperties;
import com.previewstudio.orchestrator.event.JobEvent;
import com.previewstudio.orchestrator.event.JobEventBus;
import com.previewstudio.orchestrator.repository.JobPaths;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs the renderer container for one job and reports what it does as
 * job events.
 *
 * run() sequence:
 *   ensure image → create → attach → start → stream output → wait
 *   → write logs/container.log → remove → complete | error
 *
 * The jobId → containerId map is the single owner of cleanup: whoever
 * removes the entry (run() after wait, or cancel()) removes the container.
 * A run whose entry was taken by cancel() returns cancelled=true and emits
 * no terminal event.
 */
@Component
public class ContainerRunner {

    private static final Logger log = LoggerFactory.getLogger(ContainerRunner.class);

    // How long to let the output pump drain after the container exited.
    private static final long PUMP_DRAIN_SECONDS = 5;

    private final DockerClient      docker;
    private final JobEventBus       events;
    private final JobPaths          paths;
    private final VolumeMounts      mounts;
    private final PreviewProperties properties;
    private final MeterRegistry     meters;

    private final Map<String, String> containers = new ConcurrentHashMap<>();

    private final ExecutorService outputPumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "renderer-output");
        t.setDaemon(true);
        return t;
    });

    public ContainerRunner(DockerClient docker, JobEventBus events, JobPaths paths,
                           VolumeMounts mounts, PreviewProperties properties, MeterRegistry meters) {
        this.docker     = docker;
        this.events     = events;
        this.paths      = paths;
        this.mounts     = mounts;
        this.properties = properties;
        this.meters     = meters;
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    /**
     * Render one job. Blocks until the container has exited and been removed.
     *
     * @throws RenderExecutionException if the container could not be run at all;
     *         a "Runner error" event has been emitted before it is thrown
     */
    public RunResult run(String jobId, RenderInputs inputs) {
        RunEvents out = new RunEvents(jobId);
        String image = properties.getRenderer().getImage();
        String containerId = null;
        InputStream output = null;
        boolean cleanupOwned = false;
        Timer.Sample sample = Timer.start(meters);

        out.log("Starting render job: " + jobId);
        try {
            Files.createDirectories(paths.configDir(jobId));
            Files.createDirectories(paths.logsDir(jobId));
            Files.createDirectories(paths.outputDir(jobId));

            List<String> binds = mounts.binds(jobId);
            out.log("Volume mounts: " + String.join(", ", binds));

            ensureImage(image, out::log);

            out.progress(10, "Creating renderer container...");
            containerId = docker.createContainer(image, inputs.command(), inputs.env(), binds);
            containers.put(jobId, containerId);

            out.progress(20, "Starting container...");
            output = docker.attach(containerId);
            StringBuilder streamed = new StringBuilder();
            Future<?> pump = outputPumps.submit(pumpOutput(output, out, streamed));

            docker.start(containerId);
            out.progress(50, "Rendering overlays...");
            log.info("Job {} rendering in container {}", jobId, DockerClient.shortId(containerId));

            int exitCode = docker.waitFor(containerId, properties.getRenderer().getWaitTimeout());
            drain(pump, jobId);

            cleanupOwned = containers.remove(jobId, containerId);
            if (!cleanupOwned) {
                log.info("Job {} container exited after cancellation (exit {})", jobId, exitCode);
                String partial;
                synchronized (streamed) {
                    partial = streamed.toString();
                }
                writeLog(jobId, partial);
                sample.stop(renderTimer("cancelled"));
                return new RunResult(exitCode, partial, true);
            }

            out.progress(90, "Container exited with code: " + exitCode);
            String fullLogs = collectLogs(containerId, streamed);
            writeLog(jobId, fullLogs);
            docker.remove(containerId, true);

            if (exitCode == 0) {
                out.emit(JobEvent.complete(exitCode));
            } else {
                out.emit(JobEvent.error("Render failed with exit code " + exitCode, exitCode));
            }
            log.info("Job {} renderer exited with code {}", jobId, exitCode);
            sample.stop(renderTimer(exitCode == 0 ? "success" : "failure"));
            return new RunResult(exitCode, fullLogs, false);

        } catch (IOException | RuntimeException e) {
            if (containerId != null && !cleanupOwned && !containers.remove(jobId, containerId)) {
                // cancel() owns this container now; the failure is the stop it caused.
                log.info("Job {} run interrupted by cancellation: {}", jobId, e.getMessage());
                sample.stop(renderTimer("cancelled"));
                return new RunResult(-1, "", true);
            }
            if (containerId != null) removeAfterFailure(jobId, containerId);

            log.error("Job {} runner error: {}", jobId, e.getMessage(), e);
            out.emit(JobEvent.error("Runner error: " + e.getMessage()));
            sample.stop(renderTimer("error"));
            throw e instanceof RenderExecutionException
                    ? (RenderExecutionException) e
                    : new RenderExecutionException("Runner error: " + e.getMessage(), e);
        } finally {
            if (output != null) closeOutput(output, jobId);
        }
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /**
     * Stop (with the configured grace period) and remove the job's container.
     * False when no container is tracked for the job or it could not be stopped.
     */
    public boolean cancel(String jobId) {
        String containerId = containers.remove(jobId);
        if (containerId == null) return false;

        long grace = properties.getRenderer().getStopTimeout().toSeconds();
        try {
            docker.stop(containerId, grace);
        } catch (DockerException e) {
            log.warn("Stopping container {} for job {} failed, forcing removal: {}",
                    DockerClient.shortId(containerId), jobId, e.getMessage());
        }
        try {
            docker.remove(containerId, true);
        } catch (DockerException e) {
            log.error("Could not remove container {} for job {}: {}",
                    DockerClient.shortId(containerId), jobId, e.getMessage());
            containers.putIfAbsent(jobId, containerId);
            return false;
        }

        events.emit(jobId, JobEvent.log("Job cancelled"));
        log.info("Job {} container {} cancelled", jobId, DockerClient.shortId(containerId));
        return true;
    }

    public boolean pause(String jobId) {
        String containerId = containers.get(jobId);
        if (containerId == null) return false;
        try {
            docker.pause(containerId);
            return true;
        } catch (DockerException e) {
            log.warn("Pausing container for job {} failed: {}", jobId, e.getMessage());
            return false;
        }
    }

    public boolean resume(String jobId) {
        String containerId = containers.get(jobId);
        if (containerId == null) return false;
        try {
            docker.unpause(containerId);
            return true;
        } catch (DockerException e) {
            log.warn("Resuming container for job {} failed: {}", jobId, e.getMessage());
            return false;
        }
    }

    /** Inspection failures are reported as NOT_FOUND. */
    public ContainerStatus status(String jobId) {
        String containerId = containers.get(jobId);
        if (containerId == null) return ContainerStatus.NOT_FOUND;
        try {
            return docker.isRunning(containerId) ? ContainerStatus.RUNNING : ContainerStatus.STOPPED;
        } catch (DockerException e) {
            log.debug("Inspecting container for job {} failed: {}", jobId, e.getMessage());
            return ContainerStatus.NOT_FOUND;
        }
    }

    public boolean isTracked(String jobId) {
        return containers.containsKey(jobId);
    }

    // ------------------------------------------------------------------
    // Image / daemon
    // ------------------------------------------------------------------

    /**
     * Make sure the renderer image is present, pulling it if needed.
     *
     * @throws RenderExecutionException if the image is missing and cannot be pulled
     */
    public void ensureImage(String image, Consumer<String> progress) {
        try {
            if (docker.imageExists(image)) return;
            progress.accept("Pulling image: " + image);
            docker.pullImage(image, progress);
            progress.accept("Pulled image: " + image);
        } catch (DockerException e) {
            throw new RenderExecutionException("Renderer image " + image + " is not available: " + e.getMessage(), e);
        }
    }

    /** Pull the renderer image ahead of the first job, if enabled. */
    public void prePullImage() {
        if (!properties.getRenderer().isPrePull()) return;
        String image = properties.getRenderer().getImage();
        try {
            ensureImage(image, line -> log.info("[pull {}] {}", image, line));
            log.info("Renderer image {} is available", image);
        } catch (RenderExecutionException e) {
            log.warn("Pre-pull of {} failed; it will be retried when a job starts: {}", image, e.getMessage());
        }
    }

    public boolean isDockerAvailable() {
        try {
            return docker.ping();
        } catch (DockerException e) {
            log.warn("Docker daemon is not reachable: {}", e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Runnable pumpOutput(InputStream output, RunEvents out, StringBuilder streamed) {
        return () -> {
            try {
                DockerStreamDecoder.pump(output, frame -> {
                    String text = frame.text();
                    synchronized (streamed) {
                        streamed.append(text);
                    }
                    for (String line : DockerStreamDecoder.lines(text)) out.log(line);
                });
            } catch (IOException e) {
                out.log("Stream error: " + e.getMessage());
            }
        };
    }

    private void drain(Future<?> pump, String jobId) {
        try {
            pump.get(PUMP_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Output stream of job {} still open {}s after exit, closing it", jobId, PUMP_DRAIN_SECONDS);
            pump.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Output pump of job {} failed: {}", jobId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderExecutionException("Interrupted while reading renderer output", e);
        }
    }

    /** Prefer the daemon's full log; fall back to what was streamed. */
    private String collectLogs(String containerId, StringBuilder streamed) {
        try {
            return docker.logs(containerId);
        } catch (DockerException e) {
            log.warn("Could not fetch logs of container {}, using streamed output: {}",
                    DockerClient.shortId(containerId), e.getMessage());
            synchronized (streamed) {
                return streamed.toString();
            }
        }
    }

    private void writeLog(String jobId, String text) throws IOException {
        Files.createDirectories(paths.logsDir(jobId));
        Files.writeString(paths.logFile(jobId), text, StandardCharsets.UTF_8);
    }

    private void removeAfterFailure(String jobId, String containerId) {
        try {
            docker.remove(containerId, true);
        } catch (DockerException e) {
            log.error("Could not remove container {} of failed job {}: {}",
                    DockerClient.shortId(containerId), jobId, e.getMessage());
        }
    }

    private void closeOutput(InputStream output, String jobId) {
        try {
            output.close();
        } catch (IOException e) {
            log.debug("Closing output stream of job {} failed: {}", jobId, e.getMessage());
        }
    }

    private Timer renderTimer(String outcome) {
        return Timer.builder("preview.render.duration")
                .description("Wall-clock time of renderer container runs")
                .tag("outcome", outcome)
                .register(meters);
    }

    /**
     * Serializes the events of one run: the worker thread and the output
     * pump both emit, and subscribers must see them one at a time.
     */
    private final class RunEvents {
        private final String jobId;

        RunEvents(String jobId) {
            this.jobId = jobId;
        }

        synchronized void emit(JobEvent event) {
            events.emit(jobId, event);
        }

        void log(String message) {
            emit(JobEvent.log(message));
        }

        void progress(int progress, String message) {
            emit(JobEvent.progress(progress, message));
        }
    }
}
