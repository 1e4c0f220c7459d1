package opsqueue.jobs.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for stale-lock recovery.
 * POST /internal/v1/jobs/recover-stale
 */
public record RecoverRequest(
        @JsonProperty("staleAfterMinutes") Integer staleAfterMinutes) {

    public static final RecoverRequest EMPTY = new RecoverRequest(null);

    /** Validate the request */
    public void validate() {
        if (staleAfterMinutes != null && (staleAfterMinutes < 1 || staleAfterMinutes > 1440)) {
            throw new IllegalArgumentException("staleAfterMinutes must be 1-1440");
        }
    }
}
