package openorchestrator.scheduler.service;

import openorchestrator.scheduler.model.Job;
import openorchestrator.scheduler.model.Trigger;

import java.nio.file.Path;

/**
 * In-memory handle of a process this scheduler launched and still tracks.
 *
 * @param process        the child process
 * @param trigger        the trigger that launched it, as claimed
 * @param job            the job row created for this run
 * @param checkoutFolder folder of the git checkout, or null for plain file triggers
 * @param stderrFile     file receiving the child's standard error
 */
public record SchedulerJob(
        Process process,
        Trigger trigger,
        Job job,
        Path checkoutFolder,
        Path stderrFile) {

    public String jobId() {
        return job.id();
    }

    public boolean blocking() {
        return trigger.blocking();
    }
}
