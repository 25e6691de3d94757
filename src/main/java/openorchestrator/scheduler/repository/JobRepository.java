package openorchestrator.scheduler.repository;

import openorchestrator.scheduler.model.Job;
import openorchestrator.scheduler.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job persistence.
 */
public interface JobRepository {

    /**
     * Create a RUNNING job row with {@code start_time = now}.
     *
     * @param processName   the process being launched
     * @param schedulerName the machine launching it
     * @return the created job
     */
    Job start(String processName, String schedulerName);

    /**
     * Set the status of a job. Any terminal status stamps {@code end_time}
     * unless it was already set.
     *
     * @return true if the job existed and had not already ended
     */
    boolean updateStatus(String jobId, JobStatus status);

    Optional<Job> findById(String jobId);

    /**
     * Most recently started jobs first.
     */
    List<Job> findRecent(int limit);
}
