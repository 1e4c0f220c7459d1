package opsqueue.jobs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input for creating a schedule. Null optional fields take the schedule
 * defaults (enabled, priority 50, three attempts, runner timeout).
 */
public record ScheduleDefinition(
        String key,
        String title,
        String description,
        JobType jobType,
        Cadence cadence,
        Map<String, Object> payloadTemplate,
        Integer priority,
        Integer maxAttempts,
        Integer timeoutSeconds,
        Boolean enabled) {

    public ScheduleDefinition {
        Objects.requireNonNull(jobType, "jobType is required");
        Objects.requireNonNull(cadence, "cadence is required");
        payloadTemplate = payloadTemplate == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payloadTemplate));
    }

    public static ScheduleDefinition of(String key, JobType jobType, Cadence cadence) {
        return new ScheduleDefinition(key, null, null, jobType, cadence, null, null, null, null, null);
    }

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }
}
