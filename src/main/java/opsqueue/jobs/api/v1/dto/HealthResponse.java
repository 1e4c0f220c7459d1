package opsqueue.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check endpoint.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("db") String db,
        @JsonProperty("queuedJobs") Integer queuedJobs,
        @JsonProperty("runningJobs") Integer runningJobs) {

    public static HealthResponse healthy(String uptime, String version, int queued, int running) {
        return new HealthResponse("UP", uptime, version, "ok", queued, running);
    }

    public static HealthResponse unhealthy(String dbError) {
        return new HealthResponse("DOWN", null, null, dbError, null, null);
    }
}
