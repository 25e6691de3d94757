package openorchestrator.scheduler.model;

import java.time.Instant;

/**
 * Liveness row of one scheduler machine.
 */
public record SchedulerHeartbeat(
        String machineName,
        Instant lastUpdate,
        String latestTrigger,
        Instant lastTriggerStart) {
}
