package openorchestrator.scheduler.model;

/**
 * Status of one process execution.
 */
public enum JobStatus {
    /** Process started and not yet reconciled */
    RUNNING,
    /** Process exited with code 0 */
    DONE,
    /** Process failed to launch or exited non-zero */
    FAILED,
    /** Process terminated by an operator */
    KILLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
