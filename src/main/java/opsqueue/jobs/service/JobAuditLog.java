package opsqueue.jobs.service;

import opsqueue.jobs.model.JobRunLog;
import opsqueue.jobs.repository.JobLogRepository;
import opsqueue.jobs.store.JobStoreException;
import opsqueue.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes job_run_logs entries. A failed write is logged and dropped, never
 * propagated into the transition that produced it.
 */
public class JobAuditLog {

    private static final Logger log = LoggerFactory.getLogger(JobAuditLog.class);

    private final JobLogRepository repository;
    private final Clock clock;

    public JobAuditLog(JobLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void info(String jobRunId, String message, Map<String, ?> meta) {
        append(jobRunId, JobRunLog.Level.INFO, message, meta);
    }

    public void warn(String jobRunId, String message, Map<String, ?> meta) {
        append(jobRunId, JobRunLog.Level.WARN, message, meta);
    }

    public void error(String jobRunId, String message, Map<String, ?> meta) {
        append(jobRunId, JobRunLog.Level.ERROR, message, meta);
    }

    public List<JobRunLog> entries(String jobRunId) {
        return repository.findByJobRunId(jobRunId);
    }

    private void append(String jobRunId, JobRunLog.Level level, String message, Map<String, ?> meta) {
        try {
            repository.append(new JobRunLog(
                    UUID.randomUUID().toString(),
                    jobRunId,
                    level,
                    message,
                    meta == null || meta.isEmpty() ? null : Json.write(meta),
                    clock.instant().truncatedTo(ChronoUnit.MILLIS)));
        } catch (JobStoreException | IllegalArgumentException e) {
            log.warn("Failed to append log entry for job {}: {}", jobRunId, e.getMessage());
        }
    }
}
