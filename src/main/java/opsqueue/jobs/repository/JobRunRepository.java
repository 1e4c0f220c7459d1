package opsqueue.jobs.repository;

import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for job run persistence.
 *
 * <p>
 * Every status change is a conditional update on the row's current status
 * (and, for running rows, the lease owner and attempt number). Methods
 * returning {@code boolean} report whether the update matched; {@code false}
 * means another process changed the row first.
 */
public interface JobRunRepository {

    /**
     * Insert a new queued row.
     *
     * @throws opsqueue.jobs.store.DedupeConflictException if another active row
     *         holds the same dedupe key
     */
    void insert(JobRun run);

    Optional<JobRun> findById(String id);

    /**
     * Find the queued or running row holding a dedupe key.
     */
    Optional<JobRun> findActiveByDedupeKey(String dedupeKey);

    /**
     * Find the most recent row with a dedupe key, in any status.
     */
    Optional<JobRun> findLatestByDedupeKey(String dedupeKey);

    /**
     * Queued rows whose run_after has passed, highest priority first, oldest first within a priority.
     */
    List<JobRun> findRunnable(Instant now, int limit);

    /**
     * Move a queued row to running under the given owner.
     *
     * @return the claimed row, or empty if it was no longer queued
     */
    Optional<JobRun> tryClaim(String id, String lockOwner, Instant now);

    /** Renew the lease of a running row */
    boolean heartbeat(String id, String lockOwner, int attempts, Instant now);

    /**
     * Hand a claimed row whose handler never started back to the queue,
     * undoing the attempt the claim counted.
     */
    boolean releaseClaim(String id, String lockOwner, int attempts, Instant now);

    boolean markSucceeded(String id, String lockOwner, int attempts, String resultJson, Instant now);

    /** Canceled by request while running */
    boolean markCanceled(String id, String lockOwner, int attempts, Instant now);

    /** Back to queued with a later run_after, keeping the dedupe key */
    boolean scheduleRetry(String id, String lockOwner, int attempts, Instant runAfter, String errorMessage,
            String errorCode, Instant now);

    boolean markDeadLetter(String id, String lockOwner, int attempts, String errorMessage, String errorCode,
            Instant now);

    /**
     * Running rows whose lease is older than the cutoff.
     * Rows without a lock timestamp are judged by started_at.
     */
    List<JobRun> findStaleRunning(Instant lockedBefore, int limit);

    /** Release an abandoned lease back to the queue */
    boolean recoverToQueued(String id, int attempts, String errorMessage, String errorCode, Instant now);

    /** Dead-letter an abandoned lease whose retry budget is spent */
    boolean recoverToDeadLetter(String id, int attempts, String errorMessage, String errorCode, Instant now);

    boolean cancelQueued(String id, Instant now);

    boolean requestCancel(String id, Instant now);

    /**
     * Put a terminal row back to queued with run_after = now.
     *
     * @throws opsqueue.jobs.store.DedupeConflictException if the dedupe key is
     *         already held by another active row
     */
    boolean requeue(String id, JobRunStatus expected, int maxAttempts, Instant now);

    /**
     * Newest rows first, optionally filtered.
     */
    List<JobRun> find(JobRunStatus status, String jobType, int limit);

    Map<JobRunStatus, Integer> countByStatus();

    int countSucceededSince(Instant since);

    int countStaleRunning(Instant lockedBefore);
}
