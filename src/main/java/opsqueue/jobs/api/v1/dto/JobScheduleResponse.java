package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.JobSchedule;
import opsqueue.jobs.util.Json;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a job schedule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("key") String key,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("isEnabled") boolean enabled,
        @JsonProperty("cadenceType") String cadenceType,
        @JsonProperty("intervalMinutes") Integer intervalMinutes,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("hour") Integer hour,
        @JsonProperty("minute") Integer minute,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("payloadTemplate") Map<String, Object> payloadTemplate,
        @JsonProperty("priority") int priority,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("nextRunAt") Instant nextRunAt,
        @JsonProperty("lastEnqueuedAt") Instant lastEnqueuedAt,
        @JsonProperty("lastRunJobId") String lastRunJobId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static JobScheduleResponse from(JobSchedule s) {
        return new JobScheduleResponse(
                s.id(),
                s.key(),
                s.title(),
                s.description(),
                s.jobType(),
                s.enabled(),
                s.cadenceType().wire(),
                s.intervalMinutes(),
                s.dayOfWeek(),
                s.dayOfMonth(),
                s.hour(),
                s.minute(),
                s.timezone(),
                Json.readObject(s.payloadTemplate()),
                s.priority(),
                s.maxAttempts(),
                s.timeoutSeconds(),
                s.nextRunAt(),
                s.lastEnqueuedAt(),
                s.lastRunJobId(),
                s.createdAt(),
                s.updatedAt());
    }
}
