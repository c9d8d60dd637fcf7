package com.previewstudio.orchestrator.artifact;

import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobTarget;
import com.previewstudio.orchestrator.repository.JobIds;
import com.previewstudio.orchestrator.repository.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a job's targets to the image files the renderer consumed and produced.
 *
 * Naming convention inside a job directory:
 * <pre>
 *   input/{targetId}.jpg              staged base artwork
 *   output/{targetId}_after.{ext}     final render
 *   output/draft/{targetId}_draft.{ext}
 * </pre>
 */
@Component
public class ArtifactResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtifactResolver.class);

    /** Probed in this order for after and draft images. */
    static final List<String> IMAGE_EXTENSIONS = List.of("png", "jpg", "jpeg", "webp");

    private static final String URL_PREFIX = "/api/preview/image/";

    private final JobPaths paths;

    public ArtifactResolver(JobPaths paths) {
        this.paths = paths;
    }

    /**
     * Resolve an image inside one of the job's image folders.
     *
     * Empty when the job id or filename is not a plain name (parent
     * references, separators, absolute paths) or the file does not exist.
     */
    public Optional<Path> resolveImagePath(String jobId, ImageFolder folder, String filename) {
        if (!JobIds.isValid(jobId) || !isPlainFilename(filename)) {
            log.warn("Rejected image path: job={} folder={} file={}", jobId, folder.value(), filename);
            return Optional.empty();
        }
        Path file = folderPath(jobId, folder).resolve(filename);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    /** Only targets whose base image was staged are listed. */
    public JobArtifacts artifacts(Job job) {
        String jobId = job.getJobId();
        List<JobArtifacts.Item> items = new ArrayList<>();

        for (JobTarget target : job.getTargets()) {
            String beforeName = target.id() + ".jpg";
            if (!Files.isRegularFile(paths.inputDir(jobId).resolve(beforeName))) continue;

            String afterName = findImage(paths.outputDir(jobId), target.id() + "_after");
            String draftName = findImage(paths.draftDir(jobId),  target.id() + "_draft");

            items.add(new JobArtifacts.Item(
                    target.id(),
                    target.title(),
                    target.type(),
                    url(jobId, ImageFolder.INPUT, beforeName),
                    afterName == null ? null : url(jobId, ImageFolder.OUTPUT, afterName),
                    draftName == null ? null : url(jobId, ImageFolder.DRAFT,  draftName),
                    target.baseSource(),
                    target.warnings()));
        }
        return new JobArtifacts(jobId, items);
    }

    public Path logPath(String jobId) {
        return paths.logFile(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path folderPath(String jobId, ImageFolder folder) {
        return switch (folder) {
            case INPUT  -> paths.inputDir(jobId);
            case OUTPUT -> paths.outputDir(jobId);
            case DRAFT  -> paths.draftDir(jobId);
        };
    }

    private static String findImage(Path dir, String baseName) {
        for (String ext : IMAGE_EXTENSIONS) {
            String name = baseName + "." + ext;
            if (Files.isRegularFile(dir.resolve(name))) return name;
        }
        return null;
    }

    private static String url(String jobId, ImageFolder folder, String filename) {
        return URL_PREFIX + jobId + "/" + folder.value() + "/" + filename;
    }

    static boolean isPlainFilename(String filename) {
        if (filename == null || filename.isBlank() || filename.contains("\\")) return false;
        try {
            Path name = Path.of(filename).getFileName();
            return name != null
                    && name.toString().equals(filename)
                    && !".".equals(filename)
                    && !"..".equals(filename);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
