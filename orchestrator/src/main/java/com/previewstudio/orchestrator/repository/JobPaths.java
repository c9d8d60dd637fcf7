package com.previewstudio.orchestrator.repository;

import com.previewstudio.orchestrator.config.PreviewProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout of a job's working directory:
 *
 * <pre>
 *   {jobsRoot}/{jobId}/job-meta.json      Job record (JobRecordStore)
 *   {jobsRoot}/{jobId}/meta.json          target metadata read by the renderer
 *   {jobsRoot}/{jobId}/input/             staged "before" artwork
 *   {jobsRoot}/{jobId}/output/            rendered "after" artwork
 *   {jobsRoot}/{jobId}/output/draft/      interim renders
 *   {jobsRoot}/{jobId}/config/            preview.yml
 *   {jobsRoot}/{jobId}/logs/container.log renderer output
 * </pre>
 */
@Component
public class JobPaths {

    public static final String RECORD_FILE = "job-meta.json";
    public static final String LOG_FILE    = "container.log";

    private final Path jobsRoot;

    @Autowired
    public JobPaths(PreviewProperties properties) {
        this(Path.of(properties.getJobs().getPath()));
    }

    public JobPaths(Path jobsRoot) {
        this.jobsRoot = jobsRoot.toAbsolutePath().normalize();
    }

    public Path jobsRoot()             { return jobsRoot; }
    public Path jobDir(String jobId)   { return jobsRoot.resolve(jobId); }
    public Path recordFile(String id)  { return jobDir(id).resolve(RECORD_FILE); }
    public Path inputDir(String id)    { return jobDir(id).resolve("input"); }
    public Path outputDir(String id)   { return jobDir(id).resolve("output"); }
    public Path draftDir(String id)    { return outputDir(id).resolve("draft"); }
    public Path configDir(String id)   { return jobDir(id).resolve("config"); }
    public Path logsDir(String id)     { return jobDir(id).resolve("logs"); }
    public Path logFile(String id)     { return logsDir(id).resolve(LOG_FILE); }
    public Path rendererMetaFile(String id) { return jobDir(id).resolve("meta.json"); }

    /** Create input/, output/draft/, config/ and logs/ for a job. */
    public void createWorkingDirs(String jobId) throws IOException {
        Files.createDirectories(inputDir(jobId));
        Files.createDirectories(draftDir(jobId));
        Files.createDirectories(configDir(jobId));
        Files.createDirectories(logsDir(jobId));
    }
}
