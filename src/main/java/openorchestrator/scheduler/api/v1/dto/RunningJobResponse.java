package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import openorchestrator.scheduler.service.SchedulerJob;

import java.time.Instant;

/**
 * A job tracked by this scheduler.
 */
public record RunningJobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("triggerId") String triggerId,
        @JsonProperty("triggerName") String triggerName,
        @JsonProperty("processName") String processName,
        @JsonProperty("blocking") boolean blocking,
        @JsonProperty("pid") long pid,
        @JsonProperty("startTime") Instant startTime) {

    public static RunningJobResponse from(SchedulerJob job) {
        return new RunningJobResponse(
                job.jobId(),
                job.trigger().id(),
                job.trigger().name(),
                job.trigger().processName(),
                job.blocking(),
                job.process().pid(),
                job.job().startTime());
    }
}
