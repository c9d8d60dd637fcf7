package com.previewstudio.orchestrator.service;

import com.previewstudio.orchestrator.config.PreviewProperties;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.queue.QueueService;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.repository.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Periodic cleanup.
 *
 * Queue entries and job records age out independently: entries follow the
 * queue's removeOnComplete / removeOnFail rules, records (with their working
 * directories) follow preview.retention. Only finished jobs are evicted.
 */
@Component
public class JobHousekeeping {

    private static final Logger log = LoggerFactory.getLogger(JobHousekeeping.class);

    private final QueueService   queue;
    private final JobRecordStore store;
    private final PreviewProperties.Retention retention;

    public JobHousekeeping(QueueService queue, JobRecordStore store, PreviewProperties properties) {
        this.queue     = queue;
        this.store     = store;
        this.retention = properties.getRetention();
    }

    @Scheduled(fixedDelayString = "${preview.queue.clean-interval-ms:600000}",
               initialDelayString = "${preview.queue.clean-initial-delay-ms:60000}")
    public void run() {
        try {
            queue.clean();
        } catch (RuntimeException e) {
            log.error("Queue cleanup failed: {}", e.getMessage(), e);
        }
        evictJobs();
    }

    /**
     * Delete finished jobs beyond the newest keepLast, or older than maxAge.
     *
     * @return number of jobs deleted
     */
    public int evictJobs() {
        Instant cutoff = Instant.now().minus(retention.getMaxAge());
        List<Job> finished = store.list().stream()
                .filter(job -> job.getStatus().isTerminal())
                .toList();

        int evicted = 0;
        for (int rank = 0; rank < finished.size(); rank++) {
            Job job = finished.get(rank);
            Instant finishedAt = job.getCompletedAt() != null ? job.getCompletedAt() : job.getUpdatedAt();
            boolean tooOld = finishedAt != null && finishedAt.isBefore(cutoff);
            if (rank < retention.getKeepLast() && !tooOld) continue;

            try {
                store.delete(job.getJobId());
                evicted++;
            } catch (JobStoreException e) {
                log.warn("Could not evict job {}: {}", job.getJobId(), e.getMessage());
            }
        }
        if (evicted > 0) log.info("Evicted {} finished job(s)", evicted);
        return evicted;
    }
}
