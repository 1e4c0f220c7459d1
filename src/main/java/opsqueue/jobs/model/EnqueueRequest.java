package opsqueue.jobs.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a caller can say about a job it wants queued.
 * Only the job type is required; unset fields take the queue defaults.
 */
public record EnqueueRequest(
        JobType jobType,
        Map<String, Object> payload,
        Integer priority,
        Integer maxAttempts,
        Integer timeoutSeconds,
        Instant runAfter,
        String dedupeKey,
        String sourceType,
        String sourceId,
        String createdByUserId) {

    public EnqueueRequest {
        Objects.requireNonNull(jobType, "jobType is required");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public static Builder builder(JobType jobType) {
        return new Builder(jobType);
    }

    public static EnqueueRequest of(JobType jobType) {
        return builder(jobType).build();
    }

    public static final class Builder {
        private final JobType jobType;
        private Map<String, Object> payload;
        private Integer priority;
        private Integer maxAttempts;
        private Integer timeoutSeconds;
        private Instant runAfter;
        private String dedupeKey;
        private String sourceType;
        private String sourceId;
        private String createdByUserId;

        private Builder(JobType jobType) {
            this.jobType = jobType;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder runAfter(Instant runAfter) {
            this.runAfter = runAfter;
            return this;
        }

        public Builder dedupeKey(String dedupeKey) {
            this.dedupeKey = dedupeKey;
            return this;
        }

        public Builder source(String sourceType, String sourceId) {
            this.sourceType = sourceType;
            this.sourceId = sourceId;
            return this;
        }

        public Builder createdByUserId(String createdByUserId) {
            this.createdByUserId = createdByUserId;
            return this;
        }

        public EnqueueRequest build() {
            return new EnqueueRequest(jobType, payload, priority, maxAttempts, timeoutSeconds, runAfter,
                    dedupeKey, sourceType, sourceId, createdByUserId);
        }
    }
}
