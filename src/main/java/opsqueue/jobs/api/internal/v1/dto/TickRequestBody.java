package opsqueue.jobs.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import opsqueue.jobs.model.TickRequest;

/**
 * Request DTO for a tick.
 * POST /internal/v1/jobs/tick
 *
 * Every field is optional; missing flags mean "do the step".
 */
public record TickRequestBody(
        @JsonProperty("run") Boolean run,
        @JsonProperty("enqueueSchedules") Boolean enqueueSchedules,
        @JsonProperty("recoverStale") Boolean recoverStale,
        @JsonProperty("limit") Integer limit) {

    public static final TickRequestBody EMPTY = new TickRequestBody(null, null, null, null);

    /** Validate the request */
    public void validate() {
        if (limit != null && (limit < 1 || limit > 50)) {
            throw new IllegalArgumentException("limit must be 1-50");
        }
    }

    public TickRequest toTickRequest() {
        return new TickRequest(run, enqueueSchedules, recoverStale, limit);
    }
}
