package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("machineName") String machineName,
        @JsonProperty("running") Boolean running,
        @JsonProperty("exclusive") Boolean exclusive,
        @JsonProperty("runningJobs") Integer runningJobs) {

    public static HealthResponse healthy(String uptime, String version, String machineName,
            boolean running, boolean exclusive, int runningJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, machineName, running, exclusive, runningJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
