package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.JobType;

import java.time.Instant;
import java.util.Map;

/**
 * Request DTO for enqueueing a job.
 * POST /api/v1/jobs
 */
public record EnqueueJobRequest(
        @JsonProperty("jobType") String jobType,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("runAfter") Instant runAfter,
        @JsonProperty("dedupeKey") String dedupeKey,
        @JsonProperty("sourceType") String sourceType,
        @JsonProperty("sourceId") String sourceId,
        @JsonProperty("createdByUserId") String createdByUserId) {

    /** Validate the request */
    public void validate() {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType is required");
        }
        if (JobType.fromWire(jobType).isEmpty()) {
            throw new IllegalArgumentException("Unknown job type: " + jobType);
        }
        if (maxAttempts != null && (maxAttempts < 1 || maxAttempts > 100)) {
            throw new IllegalArgumentException("maxAttempts must be 1-100");
        }
        if (timeoutSeconds != null && (timeoutSeconds < 1 || timeoutSeconds > 86400)) {
            throw new IllegalArgumentException("timeoutSeconds must be 1-86400");
        }
        if (dedupeKey != null && dedupeKey.length() > 255) {
            throw new IllegalArgumentException("dedupeKey must be at most 255 characters");
        }
    }

    public EnqueueRequest toEnqueueRequest() {
        return EnqueueRequest.builder(JobType.parse(jobType))
                .payload(payload)
                .priority(priority)
                .maxAttempts(maxAttempts)
                .timeoutSeconds(timeoutSeconds)
                .runAfter(runAfter)
                .dedupeKey(dedupeKey)
                .source(sourceType, sourceId)
                .createdByUserId(createdByUserId)
                .build();
    }
}
