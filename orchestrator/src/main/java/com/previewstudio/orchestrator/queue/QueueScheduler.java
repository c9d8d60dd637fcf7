package com.previewstudio.orchestrator.queue;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background dispatcher for the preview queue.
 *
 * Every tick, if the worker is idle, it claims one WAITING entry and runs
 * it on the single worker thread. Renders are long and use the whole
 * Docker host, so concurrency is fixed at 1.
 *
 * While a job runs, its lock is renewed well before it expires; a lock
 * that does expire (process crash, hung worker) is picked up by the
 * stall check and the entry is re-dispatched or failed.
 */
@Component
@EnableScheduling
public class QueueScheduler {

    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> new Thread(r, "preview-queue-worker"));

    private final AtomicBoolean busy = new AtomicBoolean(false);

    // Job currently on the worker thread, for lock renewal.
    private volatile ActiveWork current;

    private final QueueService queue;

    public QueueScheduler(QueueService queue) {
        this.queue = queue;
    }

    /**
     * Tick: claim one entry (if the worker is idle and one is claimable)
     * and hand it to the worker thread.
     */
    @Scheduled(fixedDelayString = "${preview.queue.dispatch-interval-ms:2000}")
    public void tick() {
        if (!busy.compareAndSet(false, true)) return;

        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        Optional<QueuedJob> claimed;
        try {
            claimed = queue.claimNext(workerId);
        } catch (RuntimeException e) {
            busy.set(false);
            log.error("Claiming the next queue entry failed: {}", e.getMessage(), e);
            return;
        }
        if (claimed.isEmpty()) {
            busy.set(false);
            return;
        }

        QueuedJob job = claimed.get();
        current = new ActiveWork(job.jobId(), workerId);
        worker.submit(() -> runJob(job, workerId));
    }

    /** Keep the active entry's lock alive while it renders. */
    @Scheduled(fixedDelayString = "${preview.queue.lock-renew-interval-ms:300000}")
    public void renewLock() {
        ActiveWork work = current;
        if (work == null) return;
        try {
            if (!queue.extendLock(work.jobId(), work.workerId())) {
                log.warn("Lost the queue lock of job {}", work.jobId());
            }
        } catch (RuntimeException e) {
            log.error("Renewing the lock of job {} failed: {}", work.jobId(), e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${preview.queue.stalled-interval-ms:30000}")
    public void checkStalled() {
        try {
            queue.recoverStalled();
        } catch (RuntimeException e) {
            log.error("Stall check failed: {}", e.getMessage(), e);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Worker thread
    // ------------------------------------------------------------------

    void runJob(QueuedJob job, String workerId) {
        MDC.put("jobId",   job.jobId());
        MDC.put("attempt", String.valueOf(job.attempt()));
        try {
            JobProcessor processor = queue.processor().orElseThrow(() ->
                    new IllegalStateException("No processor bound to the queue"));
            JobResult result = processor.process(job);
            queue.complete(job.jobId(), workerId, result);
        } catch (Exception e) {
            log.error("Job {} failed on attempt {}: {}", job.jobId(), job.attempt(), e.getMessage(), e);
            recordFailure(job, workerId, e);
        } finally {
            current = null;
            busy.set(false);
            MDC.clear();
        }
    }

    private void recordFailure(QueuedJob job, String workerId, Exception cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            queue.fail(job.jobId(), workerId, reason);
        } catch (RuntimeException e) {
            log.error("Could not record the failure of job {}; the stall check will recover it: {}",
                    job.jobId(), e.getMessage(), e);
        }
    }

    private record ActiveWork(String jobId, String workerId) {}
}
