package com.previewstudio.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Durable storage for Job records: one JSON file per job plus an
 * in-memory read cache.
 *
 * Writes go to a temp file and are moved into place atomically, so a crash
 * never leaves a half-written job-meta.json. The cache is only updated after
 * the file write succeeded; it never holds state that is not on disk.
 *
 * Writes are serialized per job id. Readers always receive copies.
 */
@Repository
public class JobRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JobRecordStore.class);

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private static final Comparator<Job> OLDEST_FIRST =
            Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final JobPaths     paths;
    private final ObjectMapper json;

    private final Map<String, Job>    cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public JobRecordStore(JobPaths paths, ObjectMapper objectMapper) {
        this.paths = paths;
        this.json  = objectMapper;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Cache first, then disk. Unknown, invalid or unreadable ids yield empty. */
    public Optional<Job> get(String jobId) {
        if (!JobIds.isValid(jobId)) return Optional.empty();

        Job cached = cache.get(jobId);
        if (cached != null) return Optional.of(cached.copy());

        return load(jobId).map(loaded -> cache.computeIfAbsent(jobId, id -> loaded).copy());
    }

    /** All readable jobs, newest first. Missing or corrupt records are skipped. */
    public List<Job> list() {
        Path root = paths.jobsRoot();
        if (!Files.isDirectory(root)) return List.of();

        List<Job> jobs = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                .map(dir -> dir.getFileName().toString())
                .forEach(id -> get(id).ifPresent(jobs::add));
        } catch (IOException e) {
            log.warn("Could not list jobs under {}: {}", root, e.getMessage());
            return List.of();
        }
        jobs.sort(NEWEST_FIRST);
        return jobs;
    }

    /**
     * The running or paused job, if any. Only one should exist; if a crash
     * left several behind, the oldest one is returned. Every record on disk
     * is considered, not only the cached ones.
     */
    public Optional<Job> activeJob() {
        return list().stream()
                .filter(job -> job.getStatus().isActive())
                .min(OLDEST_FIRST);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /** Write the record to disk, then to the cache. */
    public void save(String jobId, Job job) {
        synchronized (lockFor(jobId)) {
            Job snapshot = job.copy();
            write(jobId, snapshot);
            cache.put(jobId, snapshot);
        }
    }

    /**
     * Move a cached job to {@code status}. No-op (returns false) when the job
     * is not cached or the transition is not allowed; in both cases nothing,
     * updatedAt included, is modified.
     *
     * Progress is never lowered here: a smaller value keeps the current one.
     */
    public boolean updateStatus(String jobId, JobStatus status, int progress, String error) {
        return mutate(jobId, job -> {
            if (!job.getStatus().canTransitionTo(status)) return false;
            job.setStatus(status);
            job.setProgress(Math.max(job.getProgress(), clamp(progress)));
            if (status.isTerminal()) job.setCompletedAt(Instant.now());
            if (error != null) job.setError(error);
            return true;
        });
    }

    /** Apply an arbitrary change (targets, exit code, warnings) to a cached job. */
    public boolean update(String jobId, Consumer<Job> change) {
        return mutate(jobId, job -> {
            change.accept(job);
            return true;
        });
    }

    /** Administrative override: any non-terminal job becomes FAILED. */
    public boolean forceFail(String jobId, String error) {
        return mutate(jobId, job -> {
            if (job.getStatus().isTerminal()) return false;
            job.setStatus(JobStatus.FAILED);
            job.setCompletedAt(Instant.now());
            job.setError(error);
            return true;
        });
    }

    /** FAILED → PENDING with progress, exit code, error and completedAt cleared. */
    public boolean resetForRetry(String jobId) {
        return mutate(jobId, job -> {
            if (job.getStatus() != JobStatus.FAILED) return false;
            job.setStatus(JobStatus.PENDING);
            job.setProgress(0);
            job.setExitCode(null);
            job.setError(null);
            job.setCompletedAt(null);
            return true;
        });
    }

    /** Remove the record and the job's whole working directory. */
    public void delete(String jobId) {
        if (!JobIds.isValid(jobId)) return;
        synchronized (lockFor(jobId)) {
            try {
                FileSystemUtils.deleteRecursively(paths.jobDir(jobId));
            } catch (IOException e) {
                throw new JobStoreException("Failed to delete job directory " + jobId, e);
            }
            cache.remove(jobId);
        }
        locks.remove(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean mutate(String jobId, Predicate<Job> change) {
        synchronized (lockFor(jobId)) {
            Job cached = cache.get(jobId);
            if (cached == null) return false;

            Job next = cached.copy();
            if (!change.test(next)) return false;
            next.setUpdatedAt(Instant.now());

            write(jobId, next);
            cache.put(jobId, next);
            return true;
        }
    }

    private Optional<Job> load(String jobId) {
        Path file = paths.recordFile(jobId);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(json.readValue(file.toFile(), Job.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable job record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String jobId, Job job) {
        Path file = paths.recordFile(jobId);
        Path tmp  = file.resolveSibling(JobPaths.RECORD_FILE + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            json.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), job);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new JobStoreException("Failed to write job record " + jobId, e);
        }
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, id -> new Object());
    }

    private static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }
}
