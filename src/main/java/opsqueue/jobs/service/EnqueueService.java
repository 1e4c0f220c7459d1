package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.EnqueueResult;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.store.DedupeConflictException;
import opsqueue.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates job rows. Never runs them.
 *
 * <p>
 * With a dedupe key, at most one queued or running row exists per key: a
 * second enqueue returns the active row with {@code created=false}. A race
 * between two inserts is settled by the unique index on the dedupe slot.
 */
public class EnqueueService {

    private static final Logger log = LoggerFactory.getLogger(EnqueueService.class);

    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final JobRunRepository jobRunRepository;
    private final JobAuditLog auditLog;
    private final QueueConfig config;
    private final Clock clock;

    public EnqueueService(JobRunRepository jobRunRepository, JobAuditLog auditLog, QueueConfig config, Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.auditLog = auditLog;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Queue a job, or return the active row already queued under the same dedupe key.
     *
     * @throws IllegalArgumentException          if maxAttempts or timeoutSeconds is out of range
     * @throws opsqueue.jobs.store.JobStoreException on store failure
     */
    public EnqueueResult enqueue(EnqueueRequest request) {
        validate(request);

        String dedupeKey = blankToNull(request.dedupeKey());
        String payload = Json.write(request.payload());

        for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
            if (dedupeKey != null) {
                Optional<JobRun> active = jobRunRepository.findActiveByDedupeKey(dedupeKey);
                if (active.isPresent()) {
                    log.debug("Job {} already active for dedupe key {}", active.get().id(), dedupeKey);
                    return new EnqueueResult(active.get().id(), active.get().status(), false);
                }
            }

            Instant now = now();
            JobRun run = JobRun.builder()
                    .id(UUID.randomUUID().toString())
                    .jobType(request.jobType())
                    .payload(payload)
                    .priority(request.priority() != null ? request.priority() : 0)
                    .status(JobRunStatus.QUEUED)
                    .attempts(0)
                    .maxAttempts(request.maxAttempts() != null ? request.maxAttempts() : config.defaultMaxAttempts())
                    .runAfter(request.runAfter() != null ? request.runAfter().truncatedTo(ChronoUnit.MILLIS) : now)
                    .timeoutSeconds(request.timeoutSeconds())
                    .dedupeKey(dedupeKey)
                    .sourceType(request.sourceType())
                    .sourceId(request.sourceId())
                    .createdByUserId(request.createdByUserId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            try {
                jobRunRepository.insert(run);
            } catch (DedupeConflictException e) {
                // Lost the insert race; the winner is normally visible now.
                log.debug("Dedupe race on key {} (attempt {})", dedupeKey, attempt);
                continue;
            }

            log.info("Enqueued job {} ({}) priority={} runAfter={}", run.id(), run.jobType(), run.priority(),
                    run.runAfter());
            auditLog.info(run.id(), "Job enqueued", dedupeKey != null
                    ? Map.of("jobType", run.jobType(), "dedupeKey", dedupeKey)
                    : Map.of("jobType", run.jobType()));
            return new EnqueueResult(run.id(), run.status(), true);
        }

        // The key kept flipping between active rows; report whichever holds it now.
        return jobRunRepository.findActiveByDedupeKey(dedupeKey)
                .map(active -> new EnqueueResult(active.id(), active.status(), false))
                .orElseThrow(() -> new IllegalStateException(
                        "Could not settle dedupe key " + dedupeKey + " after " + MAX_INSERT_ATTEMPTS + " attempts"));
    }

    private void validate(EnqueueRequest request) {
        if (request.maxAttempts() != null && request.maxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (request.timeoutSeconds() != null && request.timeoutSeconds() < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be at least 1");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
