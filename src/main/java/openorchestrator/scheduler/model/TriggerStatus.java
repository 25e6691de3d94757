package openorchestrator.scheduler.model;

/**
 * Trigger lifecycle status.
 */
public enum TriggerStatus {
    /** Waiting to become due */
    IDLE,
    /** Claimed by a scheduler, job in flight */
    RUNNING,
    /** Last launch or run failed */
    FAILED,
    /** Single trigger that has fired */
    DONE,
    /** Disabled by an operator */
    PAUSED,
    /** Pause requested while a job was in flight */
    PAUSING
}
