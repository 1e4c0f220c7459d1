package opsqueue.jobs.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for the due-schedule pass.
 * POST /internal/v1/schedules/enqueue-due
 */
public record EnqueueDueRequest(
        @JsonProperty("limit") Integer limit) {

    public static final EnqueueDueRequest EMPTY = new EnqueueDueRequest(null);

    /** Validate the request */
    public void validate() {
        if (limit != null && (limit < 1 || limit > 50)) {
            throw new IllegalArgumentException("limit must be 1-50");
        }
    }
}
