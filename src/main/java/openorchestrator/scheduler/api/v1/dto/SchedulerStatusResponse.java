package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the scheduler's operating state.
 * GET /api/v1/scheduler
 */
public record SchedulerStatusResponse(
        @JsonProperty("machineName") String machineName,
        @JsonProperty("running") boolean running,
        @JsonProperty("exclusive") boolean exclusive,
        @JsonProperty("jobs") List<RunningJobResponse> jobs) {
}
