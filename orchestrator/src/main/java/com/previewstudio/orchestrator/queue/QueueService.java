package com.previewstudio.orchestrator.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewstudio.orchestrator.config.QueueProperties;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.QueueEntry;
import com.previewstudio.orchestrator.model.QueueEntryState;
import com.previewstudio.orchestrator.repository.JobIds;
import com.previewstudio.orchestrator.repository.JobRecordStore;
import com.previewstudio.orchestrator.repository.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Durable single-worker job queue backed by the queue_entries table.
 *
 * The DB row is the queue: dispatch is a SELECT ... FOR UPDATE on the
 * oldest claimable WAITING row, done by QueueScheduler on its tick.
 * At most one entry is ACTIVE at a time.
 *
 * Entry transitions:
 *   WAITING → ACTIVE                       claimNext()
 *   ACTIVE  → COMPLETED                    complete()
 *   ACTIVE  → WAITING (backoff) | FAILED   fail(), recoverStalled()
 *   FAILED  → WAITING                      retry()
 *   WAITING → FAILED                       discard()
 *
 * All public methods that touch the DB are @Transactional so the claim
 * lock and the following UPDATE are atomic.
 */
@Service
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    static final String STALLED_REASON = "job stalled more than allowable limit";

    private final QueueEntryRepository entries;
    private final JobRecordStore       store;
    private final QueueProperties      properties;
    private final ObjectMapper         json;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean paused      = new AtomicBoolean(false);
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

    private volatile JobProcessor processor;

    public QueueService(QueueEntryRepository entries,
                        JobRecordStore store,
                        QueueProperties properties,
                        ObjectMapper objectMapper) {
        this.entries    = entries;
        this.store      = store;
        this.properties = properties;
        this.json       = objectMapper;
    }

    // ------------------------------------------------------------------
    // Setup
    // ------------------------------------------------------------------

    /** Bind the processing function. Only the first call has any effect. */
    public void initialize(JobProcessor processor) {
        if (!initialized.compareAndSet(false, true)) {
            log.warn("Queue '{}' already initialized, ignoring second initialize()", properties.getName());
            return;
        }
        this.processor = processor;
        log.info("Queue '{}' initialized (attempts={}, lock={}, maxStalled={})",
                properties.getName(), properties.getAttempts(),
                properties.getLockDuration(), properties.getMaxStalledCount());
    }

    public Optional<JobProcessor> processor() {
        return Optional.ofNullable(processor);
    }

    public void addListener(QueueEventListener listener) {
        listeners.add(listener);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Enqueue an entry and create its pending Job record under the same id.
     *
     * The entry is flushed first, so a failed insert leaves no record behind.
     * A record written before a failed write or a rolled-back commit is
     * deleted again.
     *
     * @param payload serialized job input, handed back verbatim to the processor
     * @return the new job id
     */
    @Transactional
    public String addJob(String payload, JobOptions options) {
        JobOptions opts = options != null ? options : JobOptions.defaults(properties);
        String jobId = JobIds.newId();

        QueueEntry entry = new QueueEntry(jobId, properties.getName(), payload);
        entry.setMaxAttempts(opts.attempts());
        entry.setBackoffDelayMs(opts.backoffDelay().toMillis());
        entries.saveAndFlush(entry);

        try {
            store.save(jobId, new Job(jobId, Instant.now()));
        } catch (RuntimeException e) {
            deleteRecord(jobId, e);
            throw e;
        }
        deleteRecordOnRollback(jobId);

        log.info("Job {} enqueued on '{}' (attempts={})", jobId, properties.getName(), opts.attempts());
        return jobId;
    }

    /**
     * Undo a submission whose follow-up setup failed: the entry is removed
     * and the record deleted. Only a WAITING entry is removed.
     */
    @Transactional
    public void withdraw(String jobId, RuntimeException cause) {
        entries.findById(jobId)
                .filter(e -> e.getState() == QueueEntryState.WAITING)
                .ifPresent(entries::delete);
        deleteRecord(jobId, cause);
        log.warn("Job {} withdrawn from queue: {}", jobId, cause.getMessage());
    }

    // ------------------------------------------------------------------
    // Dispatch (called by QueueScheduler)
    // ------------------------------------------------------------------

    /**
     * Claim the next claimable entry for {@code workerId}.
     *
     * Empty while the queue is paused, no processor is bound, or another
     * entry is still ACTIVE.
     */
    @Transactional
    public Optional<QueuedJob> claimNext(String workerId) {
        if (paused.get() || processor == null) return Optional.empty();
        if (entries.existsByQueueNameAndState(properties.getName(), QueueEntryState.ACTIVE)) {
            return Optional.empty();
        }

        Instant now = Instant.now();
        Optional<QueueEntry> claimed = entries.claimNext(properties.getName(), QueueEntryState.WAITING, now);
        if (claimed.isEmpty()) return Optional.empty();

        QueueEntry entry = claimed.get();
        entry.setState(QueueEntryState.ACTIVE);
        entry.setWorkerId(workerId);
        entry.setLockedUntil(now.plus(properties.getLockDuration()));
        entry.setStartedAt(now);
        entry.setAttemptsMade(entry.getAttemptsMade() + 1);
        entries.save(entry);

        String jobId  = entry.getJobId();
        int   attempt = entry.getAttemptsMade();
        log.info("Worker '{}' claimed job {} (attempt {}/{})", workerId, jobId, attempt, entry.getMaxAttempts());
        notifyListeners(l -> l.onActive(jobId, attempt));

        return Optional.of(new QueuedJob(jobId, entry.getPayload(), attempt,
                progress -> reportProgress(jobId, workerId, progress)));
    }

    @Transactional
    public void complete(String jobId, String workerId, JobResult result) {
        Optional<QueueEntry> owned = ownedActive(jobId, workerId, "complete");
        if (owned.isEmpty()) return;

        QueueEntry entry = owned.get();
        entry.setState(QueueEntryState.COMPLETED);
        entry.setProgress(100);
        entry.setFinishedAt(Instant.now());
        entry.setReturnValue(toJson(result));
        releaseLock(entry);
        entries.save(entry);

        log.info("Job {} completed on queue '{}'", jobId, properties.getName());
        notifyListeners(l -> l.onCompleted(jobId, result));
    }

    /**
     * Fail the current attempt. With attempts left the entry goes back to
     * WAITING after an exponential backoff; otherwise it is FAILED for good.
     */
    @Transactional
    public void fail(String jobId, String workerId, String reason) {
        Optional<QueueEntry> owned = ownedActive(jobId, workerId, "fail");
        if (owned.isEmpty()) return;

        QueueEntry entry = owned.get();
        entry.setFailedReason(reason);
        releaseLock(entry);

        boolean willRetry = entry.getAttemptsMade() < entry.getMaxAttempts();
        if (willRetry) {
            Duration backoff = JobOptions.backoffFor(entry.getBackoffDelayMs(), entry.getAttemptsMade());
            entry.setState(QueueEntryState.WAITING);
            entry.setAvailableAt(Instant.now().plus(backoff));
            log.warn("Job {} failed (attempt {}/{}), retrying in {}. Reason: {}",
                    jobId, entry.getAttemptsMade(), entry.getMaxAttempts(), backoff, reason);
        } else {
            entry.setState(QueueEntryState.FAILED);
            entry.setFinishedAt(Instant.now());
            log.error("Job {} failed permanently after {} attempt(s): {}", jobId, entry.getAttemptsMade(), reason);
        }
        entries.save(entry);
        notifyListeners(l -> l.onFailed(jobId, reason, willRetry));
    }

    /** Push the lock expiry forward. False if the worker no longer owns the entry. */
    @Transactional
    public boolean extendLock(String jobId, String workerId) {
        Optional<QueueEntry> owned = ownedActive(jobId, workerId, "extend lock of");
        owned.ifPresent(entry -> {
            entry.setLockedUntil(Instant.now().plus(properties.getLockDuration()));
            entries.save(entry);
        });
        return owned.isPresent();
    }

    /** Record progress on the entry and raise a progress event. */
    @Transactional
    public void reportProgress(String jobId, String workerId, int progress) {
        Optional<QueueEntry> owned = ownedActive(jobId, workerId, "report progress of");
        if (owned.isEmpty()) return;

        QueueEntry entry = owned.get();
        entry.setProgress(Math.max(0, Math.min(100, progress)));
        entries.save(entry);
        notifyListeners(l -> l.onProgress(jobId, progress));
    }

    /**
     * Detect ACTIVE entries whose lock expired (worker crashed or hung).
     *
     * A stalled entry is re-dispatched up to maxStalledCount times; after
     * that it is failed with "job stalled more than allowable limit".
     *
     * @return number of stalled entries found
     */
    @Transactional
    public int recoverStalled() {
        List<QueueEntry> stalled = entries.findByQueueNameAndStateAndLockedUntilBefore(
                properties.getName(), QueueEntryState.ACTIVE, Instant.now());

        for (QueueEntry entry : stalled) {
            String jobId = entry.getJobId();
            log.warn("Job {} stalled (worker={}, lock expired {})", jobId, entry.getWorkerId(), entry.getLockedUntil());
            entry.setStalledCount(entry.getStalledCount() + 1);
            releaseLock(entry);
            notifyListeners(l -> l.onStalled(jobId));

            if (entry.getStalledCount() > properties.getMaxStalledCount()) {
                entry.setState(QueueEntryState.FAILED);
                entry.setFailedReason(STALLED_REASON);
                entry.setFinishedAt(Instant.now());
                entries.save(entry);
                notifyListeners(l -> l.onFailed(jobId, STALLED_REASON, false));
            } else {
                // The interrupted attempt does not count against the entry's attempts.
                entry.setState(QueueEntryState.WAITING);
                entry.setAttemptsMade(Math.max(0, entry.getAttemptsMade() - 1));
                entry.setAvailableAt(Instant.now());
                entries.save(entry);
            }
        }
        return stalled.size();
    }

    // ------------------------------------------------------------------
    // Administration
    // ------------------------------------------------------------------

    /** FAILED → WAITING with counters reset. False when the entry is missing or not failed. */
    @Transactional
    public boolean retry(String jobId) {
        Optional<QueueEntry> found = entries.findById(jobId)
                .filter(e -> e.getState() == QueueEntryState.FAILED);
        found.ifPresent(entry -> {
            entry.setState(QueueEntryState.WAITING);
            entry.setAttemptsMade(0);
            entry.setStalledCount(0);
            entry.setProgress(0);
            entry.setFailedReason(null);
            entry.setFinishedAt(null);
            entry.setStartedAt(null);
            entry.setAvailableAt(Instant.now());
            entries.save(entry);
            log.info("Job {} re-queued for a manual retry", jobId);
        });
        return found.isPresent();
    }

    /** Drop a WAITING entry so it is never dispatched. */
    @Transactional
    public boolean discard(String jobId, String reason) {
        Optional<QueueEntry> found = entries.findById(jobId)
                .filter(e -> e.getState() == QueueEntryState.WAITING);
        found.ifPresent(entry -> {
            entry.setState(QueueEntryState.FAILED);
            entry.setFailedReason(reason);
            entry.setFinishedAt(Instant.now());
            entries.save(entry);
            log.info("Job {} discarded from queue: {}", jobId, reason);
        });
        return found.isPresent();
    }

    /**
     * Apply the retention rules to finished entries. An entry is removed when
     * its rank (newest first) reaches the count or it is older than the age
     * window. Job records are not touched.
     *
     * @return number of entries removed
     */
    @Transactional
    public int clean() {
        int removed = prune(QueueEntryState.COMPLETED, properties.getRemoveOnComplete())
                    + prune(QueueEntryState.FAILED,    properties.getRemoveOnFail());
        if (removed > 0) log.info("Queue '{}' cleanup removed {} finished entries", properties.getName(), removed);
        return removed;
    }

    @Transactional(readOnly = true)
    public Optional<QueueEntry> findEntry(String jobId) {
        return entries.findById(jobId);
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        String name = properties.getName();
        return new QueueStats(name,
                entries.countByQueueNameAndState(name, QueueEntryState.WAITING),
                entries.countByQueueNameAndState(name, QueueEntryState.ACTIVE),
                entries.countByQueueNameAndState(name, QueueEntryState.COMPLETED),
                entries.countByQueueNameAndState(name, QueueEntryState.FAILED),
                paused.get());
    }

    /** Stop dispatching new entries. The active entry keeps running. */
    public void pause() {
        if (paused.compareAndSet(false, true)) log.info("Queue '{}' paused", properties.getName());
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) log.info("Queue '{}' resumed", properties.getName());
    }

    public boolean isPaused() {
        return paused.get();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void deleteRecordOnRollback(String jobId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) return;
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_ROLLED_BACK) return;
                try {
                    store.delete(jobId);
                    log.warn("Job {} record deleted: its queue entry was rolled back", jobId);
                } catch (JobStoreException e) {
                    log.error("Job {} record left behind after rollback: {}", jobId, e.getMessage(), e);
                }
            }
        });
    }

    private void deleteRecord(String jobId, RuntimeException cause) {
        try {
            store.delete(jobId);
        } catch (JobStoreException e) {
            cause.addSuppressed(e);
        }
    }

    private Optional<QueueEntry> ownedActive(String jobId, String workerId, String opName) {
        Optional<QueueEntry> entry = entries.findById(jobId)
                .filter(e -> e.getState() == QueueEntryState.ACTIVE && workerId.equals(e.getWorkerId()));
        if (entry.isEmpty()) {
            log.warn("Worker '{}' cannot {} job {}: entry is no longer active for this worker", workerId, opName, jobId);
        }
        return entry;
    }

    private int prune(QueueEntryState state, QueueProperties.Retention retention) {
        List<QueueEntry> finished = entries.findByQueueNameAndStateOrderByFinishedAtDesc(properties.getName(), state);
        Instant cutoff = Instant.now().minus(retention.getAge());

        int removed = 0;
        for (int rank = 0; rank < finished.size(); rank++) {
            QueueEntry entry = finished.get(rank);
            boolean tooOld = entry.getFinishedAt() != null && entry.getFinishedAt().isBefore(cutoff);
            if (rank >= retention.getCount() || tooOld) {
                entries.delete(entry);
                removed++;
            }
        }
        return removed;
    }

    private static void releaseLock(QueueEntry entry) {
        entry.setWorkerId(null);
        entry.setLockedUntil(null);
    }

    private void notifyListeners(Consumer<QueueEventListener> call) {
        for (QueueEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Queue listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize queue return value: {}", e.getMessage());
            return null;
        }
    }
}
