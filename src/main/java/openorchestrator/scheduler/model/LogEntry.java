package openorchestrator.scheduler.model;

import java.time.Instant;

/**
 * Operator-facing log row. {@code jobId} is null for rows not tied to a job.
 */
public record LogEntry(
        String id,
        Instant logTime,
        LogLevel level,
        String processName,
        String jobId,
        String message) {
}
