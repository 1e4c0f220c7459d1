package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.CancelResult;
import opsqueue.jobs.model.JobDetails;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.QueueSummary;
import opsqueue.jobs.model.RequeueResult;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.repository.JobScheduleRepository;
import opsqueue.jobs.store.DedupeConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator actions on individual jobs, and the queue summary.
 */
public class JobAdminService {

    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT = 200;

    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final JobRunRepository jobRunRepository;
    private final JobScheduleRepository scheduleRepository;
    private final JobAuditLog auditLog;
    private final QueueConfig config;
    private final Clock clock;

    public JobAdminService(JobRunRepository jobRunRepository, JobScheduleRepository scheduleRepository,
            JobAuditLog auditLog, QueueConfig config, Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.scheduleRepository = scheduleRepository;
        this.auditLog = auditLog;
        this.config = config;
        this.clock = clock;
    }

    public Optional<JobDetails> find(String id) {
        return jobRunRepository.findById(id)
                .map(run -> new JobDetails(run, auditLog.entries(id)));
    }

    public List<JobRun> list(JobRunStatus status, String jobType, int limit) {
        return jobRunRepository.find(status, jobType, Math.max(1, Math.min(MAX_LIST_LIMIT, limit)));
    }

    /**
     * Put a dead-lettered, failed or canceled job back in the queue, runnable
     * now. Attempts are kept; an exhausted budget is raised by one so the job
     * gets another try.
     */
    public RequeueResult requeue(String id) {
        Optional<JobRun> found = jobRunRepository.findById(id);
        if (found.isEmpty()) {
            return RequeueResult.NOT_FOUND;
        }
        JobRun run = found.get();
        if (!JobRunStatus.REQUEUEABLE.contains(run.status())) {
            return RequeueResult.NOT_REQUEUEABLE;
        }

        int maxAttempts = Math.max(run.maxAttempts(), run.attempts() + 1);
        try {
            if (!jobRunRepository.requeue(id, run.status(), maxAttempts, now())) {
                // Someone else requeued it first.
                return RequeueResult.NOT_REQUEUEABLE;
            }
        } catch (DedupeConflictException e) {
            log.warn("Cannot requeue job {}: dedupe key {} is held by another active job", id, e.dedupeKey());
            return RequeueResult.DEDUPE_CONFLICT;
        }

        log.info("Requeued job {} ({}) from {}", id, run.jobType(), run.status().wire());
        auditLog.info(id, "Job requeued", Map.of(
                "from", run.status().wire(),
                "attempts", run.attempts(),
                "maxAttempts", maxAttempts));
        return RequeueResult.REQUEUED;
    }

    /**
     * Cancel a queued job at once, or ask a running one to stop.
     */
    public CancelResult cancel(String id) {
        for (int attempt = 0; attempt < MAX_CANCEL_ATTEMPTS; attempt++) {
            Optional<JobRun> found = jobRunRepository.findById(id);
            if (found.isEmpty()) {
                return CancelResult.NOT_FOUND;
            }
            JobRun run = found.get();
            Instant now = now();

            switch (run.status()) {
                case QUEUED -> {
                    if (jobRunRepository.cancelQueued(id, now)) {
                        log.info("Canceled queued job {}", id);
                        auditLog.info(id, "Job canceled", Map.of("by", "operator"));
                        return CancelResult.CANCELED;
                    }
                }
                case RUNNING -> {
                    if (jobRunRepository.requestCancel(id, now)) {
                        log.info("Cancel requested for running job {}", id);
                        auditLog.info(id, "Cancel requested", Map.of("lockOwner",
                                run.lockOwner() != null ? run.lockOwner() : ""));
                        return CancelResult.CANCEL_REQUESTED;
                    }
                }
                default -> {
                    return CancelResult.ALREADY_TERMINAL;
                }
            }
            log.debug("Job {} changed status during cancel, retrying", id);
        }
        return jobRunRepository.findById(id)
                .map(run -> run.isTerminal() ? CancelResult.ALREADY_TERMINAL : CancelResult.CANCEL_REQUESTED)
                .orElse(CancelResult.NOT_FOUND);
    }

    public QueueSummary summary() {
        Instant now = now();
        Map<JobRunStatus, Integer> counts = jobRunRepository.countByStatus();
        Duration staleAfter = config.staleLockThreshold();
        return new QueueSummary(
                counts.getOrDefault(JobRunStatus.QUEUED, 0),
                counts.getOrDefault(JobRunStatus.RUNNING, 0),
                counts.getOrDefault(JobRunStatus.FAILED, 0),
                counts.getOrDefault(JobRunStatus.DEAD_LETTER, 0),
                jobRunRepository.countSucceededSince(now.minus(Duration.ofHours(24))),
                jobRunRepository.countStaleRunning(now.minus(staleAfter)),
                scheduleRepository.countDue(now));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
