package openorchestrator.scheduler.repository;

import openorchestrator.scheduler.model.LogEntry;
import openorchestrator.scheduler.model.LogLevel;

import java.util.List;

/**
 * Repository interface for the operator-facing process log.
 */
public interface LogRepository {

    void create(String processName, LogLevel level, String message);

    void create(String processName, String jobId, LogLevel level, String message);

    /**
     * Newest rows first.
     */
    List<LogEntry> findRecent(int limit);

    /**
     * Newest rows of one process first.
     */
    List<LogEntry> findByProcess(String processName, int limit);
}
