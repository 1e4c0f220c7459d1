package opsqueue.jobs.scheduler;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.RecoveryResult;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.service.JobAuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Recovers jobs left RUNNING by a runner that crashed or hung.
 *
 * Jobs get stuck if:
 * - The invoking process dies mid-batch
 * - A handler ignores its timeout and never returns
 * - The resolve update fails after the handler finished
 *
 * For each running row whose lease is older than the threshold:
 * - If attempts < maxAttempts: back to queued, runnable now
 * - Otherwise: dead_letter with STALE_LOCK
 *
 * Each transition is fenced on the attempt number that was read, so a row
 * re-claimed in between is left alone.
 */
public class StaleLockRecovery {

    private static final Logger log = LoggerFactory.getLogger(StaleLockRecovery.class);

    public static final String ERROR_CODE = "STALE_LOCK";

    static final int BATCH_LIMIT = 500;

    private final JobRunRepository jobRunRepository;
    private final JobAuditLog auditLog;
    private final QueueConfig config;
    private final Clock clock;

    public StaleLockRecovery(JobRunRepository jobRunRepository, JobAuditLog auditLog, QueueConfig config,
            Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.auditLog = auditLog;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Recover with the configured threshold.
     */
    public RecoveryResult recoverStale() {
        return recoverStale(config.staleLockThreshold());
    }

    public RecoveryResult recoverStale(int staleAfterMinutes) {
        if (staleAfterMinutes <= 0) {
            throw new IllegalArgumentException("staleAfterMinutes must be positive");
        }
        return recoverStale(Duration.ofMinutes(staleAfterMinutes));
    }

    private RecoveryResult recoverStale(Duration threshold) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant cutoff = now.minus(threshold);

        List<JobRun> stale = jobRunRepository.findStaleRunning(cutoff, BATCH_LIMIT);

        if (stale.isEmpty()) {
            log.debug("No stale running jobs found");
            return RecoveryResult.empty();
        }

        int requeued = 0;
        int deadLettered = 0;

        for (JobRun run : stale) {
            String message = "Lock went stale after " + threshold.toMinutes() + " minutes (attempt "
                    + run.attempts() + "/" + run.maxAttempts() + ", owner " + run.lockOwner() + ")";
            if (run.canRetry()) {
                if (jobRunRepository.recoverToQueued(run.id(), run.attempts(), message, ERROR_CODE, now)) {
                    requeued++;
                    log.info("Recovered stale job {} ({}) for retry (attempt {} of {})",
                            run.id(), run.jobType(), run.attempts(), run.maxAttempts());
                    auditLog.warn(run.id(), "Recovered stale lock, requeued",
                            recoveryMeta(run));
                } else {
                    log.debug("Stale job {} changed before recovery, skipped", run.id());
                }
            } else {
                if (jobRunRepository.recoverToDeadLetter(run.id(), run.attempts(), message, ERROR_CODE, now)) {
                    deadLettered++;
                    log.warn("Stale job {} ({}) dead-lettered after {} attempts",
                            run.id(), run.jobType(), run.attempts());
                    auditLog.error(run.id(), "Recovered stale lock, dead-lettered (max attempts)",
                            recoveryMeta(run));
                } else {
                    log.debug("Stale job {} changed before recovery, skipped", run.id());
                }
            }
        }

        log.info("Stale-lock recovery: {} requeued, {} dead-lettered, {} stale found",
                requeued, deadLettered, stale.size());

        return new RecoveryResult(requeued + deadLettered, requeued, deadLettered);
    }

    private static Map<String, Object> recoveryMeta(JobRun run) {
        return Map.of(
                "attempts", run.attempts(),
                "maxAttempts", run.maxAttempts(),
                "lockOwner", run.lockOwner() != null ? run.lockOwner() : "");
    }
}
