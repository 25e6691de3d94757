package openorchestrator.scheduler.model;

/**
 * Trigger kinds, declared in dispatch precedence order.
 * On equal priority a single trigger runs before a scheduled one,
 * and a scheduled one before a queue trigger.
 */
public enum TriggerType {
    SINGLE,
    SCHEDULED,
    QUEUE;

    public int precedence() {
        return ordinal();
    }
}
