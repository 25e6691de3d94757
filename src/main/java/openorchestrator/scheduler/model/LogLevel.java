package openorchestrator.scheduler.model;

/**
 * Level of an operator-facing log row.
 */
public enum LogLevel {
    TRACE,
    INFO,
    ERROR
}
