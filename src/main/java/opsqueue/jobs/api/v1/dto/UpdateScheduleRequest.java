package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.CadenceType;
import opsqueue.jobs.model.SchedulePatch;

import java.util.Map;

/**
 * Request DTO for a partial schedule update.
 * PATCH /api/v1/job-schedules/{id}
 */
public record UpdateScheduleRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("isEnabled") Boolean enabled,
        @JsonProperty("cadenceType") String cadenceType,
        @JsonProperty("intervalMinutes") Integer intervalMinutes,
        @JsonProperty("dayOfWeek") Integer dayOfWeek,
        @JsonProperty("dayOfMonth") Integer dayOfMonth,
        @JsonProperty("hour") Integer hour,
        @JsonProperty("minute") Integer minute,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("payloadTemplate") Map<String, Object> payloadTemplate,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds) {

    /**
     * @param clearTimeout whether the body sent {@code "timeoutSeconds": null}
     */
    public SchedulePatch toPatch(boolean clearTimeout) {
        if (clearTimeout && timeoutSeconds != null) {
            throw new IllegalArgumentException("timeoutSeconds cannot be both set and cleared");
        }
        return new SchedulePatch(
                title,
                description,
                enabled,
                cadenceType != null ? CadenceType.fromWire(cadenceType) : null,
                intervalMinutes,
                dayOfWeek,
                dayOfMonth,
                hour,
                minute,
                timezone,
                payloadTemplate,
                priority,
                maxAttempts,
                timeoutSeconds,
                clearTimeout);
    }
}
