package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.Cadence;
import opsqueue.jobs.model.CadenceType;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.ScheduleDefinition;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Request DTO for creating a schedule.
 * POST /api/v1/job-schedules
 */
public record CreateScheduleRequest(
        @JsonProperty("key") String key,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("jobType") String jobType,
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

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9._-]{0,99}$");

    /** Validate the request */
    public void validate() {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException(
                    "key must be 1-100 characters of lowercase letters, digits, '.', '_' or '-'");
        }
        if (jobType == null || JobType.fromWire(jobType).isEmpty()) {
            throw new IllegalArgumentException("Unknown job type: " + jobType);
        }
        if (cadenceType == null) {
            throw new IllegalArgumentException("cadenceType is required");
        }
        cadence().validate();
        if (maxAttempts != null && (maxAttempts < 1 || maxAttempts > 100)) {
            throw new IllegalArgumentException("maxAttempts must be 1-100");
        }
        if (timeoutSeconds != null && (timeoutSeconds < 1 || timeoutSeconds > 86400)) {
            throw new IllegalArgumentException("timeoutSeconds must be 1-86400");
        }
    }

    public Cadence cadence() {
        return new Cadence(CadenceType.fromWire(cadenceType), intervalMinutes, dayOfWeek, dayOfMonth, hour, minute,
                Cadence.zoneOf(timezone));
    }

    public ScheduleDefinition toDefinition() {
        return new ScheduleDefinition(key, title, description, JobType.parse(jobType), cadence(), payloadTemplate,
                priority, maxAttempts, timeoutSeconds, enabled);
    }
}
