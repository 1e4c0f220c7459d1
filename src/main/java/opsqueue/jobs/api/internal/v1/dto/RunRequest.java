package opsqueue.jobs.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a single runner pass.
 * POST /internal/v1/jobs/run
 */
public record RunRequest(
        @JsonProperty("limit") Integer limit,
        @JsonProperty("runnerId") String runnerId) {

    public static final RunRequest EMPTY = new RunRequest(null, null);

    /** Validate the request */
    public void validate() {
        if (limit != null && (limit < 1 || limit > 50)) {
            throw new IllegalArgumentException("limit must be 1-50");
        }
        if (runnerId != null && (runnerId.isBlank() || runnerId.length() > 200)) {
            throw new IllegalArgumentException("runnerId must be 1-200 characters");
        }
    }

    public int limitOrDefault(int defaultLimit) {
        return limit != null ? limit : defaultLimit;
    }
}
