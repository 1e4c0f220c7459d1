package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunLog;
import opsqueue.jobs.util.Json;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a job run.
 * GET /api/v1/jobs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunResponse(
        @JsonProperty("id") String id,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("priority") int priority,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("runAfter") Instant runAfter,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("dedupeKey") String dedupeKey,
        @JsonProperty("lockOwner") String lockOwner,
        @JsonProperty("lockedAt") Instant lockedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorCode") String errorCode,
        @JsonProperty("deadLetteredAt") Instant deadLetteredAt,
        @JsonProperty("cancelRequestedAt") Instant cancelRequestedAt,
        @JsonProperty("canceledAt") Instant canceledAt,
        @JsonProperty("sourceType") String sourceType,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("logs") List<LogEntry> logs) {

    /** One audit log line */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogEntry(
            @JsonProperty("level") String level,
            @JsonProperty("message") String message,
            @JsonProperty("meta") Map<String, Object> meta,
            @JsonProperty("createdAt") Instant createdAt) {

        public static LogEntry from(JobRunLog entry) {
            return new LogEntry(
                    entry.level().wire(),
                    entry.message(),
                    entry.metaJson() != null ? Json.readObject(entry.metaJson()) : null,
                    entry.createdAt());
        }
    }

    /** Create response from domain model */
    public static JobRunResponse from(JobRun run) {
        return from(run, null);
    }

    /** Create response with the audit log */
    public static JobRunResponse from(JobRun run, List<JobRunLog> logs) {
        return new JobRunResponse(
                run.id(),
                run.jobType(),
                run.status().wire(),
                run.priority(),
                run.attempts(),
                run.maxAttempts(),
                run.runAfter(),
                run.timeoutSeconds(),
                run.dedupeKey(),
                run.lockOwner(),
                run.lockedAt(),
                run.startedAt(),
                run.finishedAt(),
                run.errorMessage(),
                run.errorCode(),
                run.deadLetteredAt(),
                run.cancelRequestedAt(),
                run.canceledAt(),
                run.sourceType(),
                run.sourceId(),
                Json.readObject(run.payload()),
                run.resultJson() != null ? Json.readObject(run.resultJson()) : null,
                run.createdAt(),
                run.updatedAt(),
                logs != null ? logs.stream().map(LogEntry::from).toList() : null);
    }
}
