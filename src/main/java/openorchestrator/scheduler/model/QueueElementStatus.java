package openorchestrator.scheduler.model;

/**
 * Processing state of a queue element. Only {@link #NEW} elements count
 * towards a queue trigger's batch threshold.
 */
public enum QueueElementStatus {
    NEW,
    IN_PROGRESS,
    DONE,
    FAILED,
    ABANDONED
}
