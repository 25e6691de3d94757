package openorchestrator.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerSchedule;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for trigger listings.
 * GET /api/v1/triggers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
        @JsonProperty("triggerId") String triggerId,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("status") String status,
        @JsonProperty("processName") String processName,
        @JsonProperty("priority") int priority,
        @JsonProperty("blocking") boolean blocking,
        @JsonProperty("schedulerWhitelist") List<String> schedulerWhitelist,
        @JsonProperty("lastRun") Instant lastRun,
        @JsonProperty("nextRun") Instant nextRun,
        @JsonProperty("cron") String cron,
        @JsonProperty("queueName") String queueName,
        @JsonProperty("minBatchSize") Integer minBatchSize) {

    public static TriggerResponse from(Trigger trigger) {
        Instant nextRun = null;
        String cron = null;
        String queueName = null;
        Integer minBatchSize = null;

        TriggerSchedule schedule = trigger.schedule();
        if (schedule instanceof TriggerSchedule.SingleSchedule single) {
            nextRun = single.nextRun();
        } else if (schedule instanceof TriggerSchedule.CronSchedule scheduled) {
            nextRun = scheduled.nextRun();
            cron = scheduled.cronExpr();
        } else if (schedule instanceof TriggerSchedule.QueueSchedule queue) {
            queueName = queue.queueName();
            minBatchSize = queue.minBatchSize();
        }

        return new TriggerResponse(
                trigger.id(),
                trigger.name(),
                trigger.type().name(),
                trigger.status().name(),
                trigger.processName(),
                trigger.priority(),
                trigger.blocking(),
                trigger.schedulerWhitelist(),
                trigger.lastRun(),
                nextRun,
                cron,
                queueName,
                minBatchSize);
    }
}
