package com.previewstudio.orchestrator.queue;

import com.previewstudio.orchestrator.model.QueueEntry;
import com.previewstudio.orchestrator.model.QueueEntryState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + dispatch queries for the queue_entries table.
 */
public interface QueueEntryRepository extends JpaRepository<QueueEntry, String> {

    /**
     * Claim the oldest WAITING entry whose backoff has elapsed.
     *
     * FOR UPDATE keeps a concurrent dispatcher from claiming the same row.
     * Must run inside a @Transactional method; the caller flips the entry
     * to ACTIVE before the transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT e FROM QueueEntry e
            WHERE e.queueName = :queueName
              AND e.state = :state
              AND e.availableAt <= :now
            ORDER BY e.createdAt ASC
            LIMIT 1
            """)
    Optional<QueueEntry> claimNext(@Param("queueName") String queueName,
                                   @Param("state") QueueEntryState state,
                                   @Param("now") Instant now);

    boolean existsByQueueNameAndState(String queueName, QueueEntryState state);

    long countByQueueNameAndState(String queueName, QueueEntryState state);

    /** ACTIVE entries whose lock expired: their worker is gone or hung. */
    List<QueueEntry> findByQueueNameAndStateAndLockedUntilBefore(String queueName, QueueEntryState state, Instant cutoff);

    /** Finished entries, newest first; retention ranks them in this order. */
    List<QueueEntry> findByQueueNameAndStateOrderByFinishedAtDesc(String queueName, QueueEntryState state);
}
