package openorchestrator.scheduler.model;

import java.time.Instant;

/**
 * A unit of work waiting in a named queue.
 */
public record QueueElement(
        String id,
        String queueName,
        QueueElementStatus status,
        String reference,
        String data,
        Instant createdDate,
        String createdBy) {
}
