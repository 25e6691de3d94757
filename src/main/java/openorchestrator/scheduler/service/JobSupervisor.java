package openorchestrator.scheduler.service;

import openorchestrator.scheduler.config.SchedulerConfig;
import openorchestrator.scheduler.model.JobStatus;
import openorchestrator.scheduler.model.LogLevel;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.repository.JobRepository;
import openorchestrator.scheduler.repository.LogRepository;
import openorchestrator.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Tracks the processes this scheduler launched and settles their outcome in the store.
 *
 * Mutations happen on the scheduler loop thread; other threads may read the
 * tracked set through {@link #runningJobs()}.
 */
public class JobSupervisor {

    private static final Logger log = LoggerFactory.getLogger(JobSupervisor.class);

    private final TriggerRepository triggerRepository;
    private final JobRepository jobRepository;
    private final LogRepository logRepository;
    private final CheckoutManager checkoutManager;
    private final Duration killTimeout;

    private final List<SchedulerJob> jobs = new CopyOnWriteArrayList<>();

    public JobSupervisor(SchedulerConfig config,
            TriggerRepository triggerRepository,
            JobRepository jobRepository,
            LogRepository logRepository,
            CheckoutManager checkoutManager) {
        this.triggerRepository = triggerRepository;
        this.jobRepository = jobRepository;
        this.logRepository = logRepository;
        this.checkoutManager = checkoutManager;
        this.killTimeout = config.killTimeout();
    }

    public void track(SchedulerJob job) {
        jobs.add(job);
        log.debug("Tracking job {} ({} running)", job.jobId(), jobs.size());
    }

    /**
     * Snapshot of the tracked jobs.
     */
    public List<SchedulerJob> runningJobs() {
        return List.copyOf(jobs);
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    /**
     * Poll every tracked process without blocking. Exited processes are settled
     * and dropped; once nothing is tracked the checkout root is wiped.
     * A job whose settlement fails stays tracked and is retried on the next call.
     *
     * @return number of jobs that finished
     */
    public int reconcile() {
        int finished = 0;

        for (SchedulerJob job : jobs) {
            if (job.process().isAlive()) {
                continue;
            }

            int exitCode = job.process().exitValue();
            try {
                if (exitCode == 0) {
                    endJob(job);
                } else {
                    failJob(job, exitCode);
                }
            } catch (Exception e) {
                log.error("Failed to settle job {} of '{}', retrying next tick",
                        job.jobId(), job.trigger().processName(), e);
                continue;
            }
            jobs.remove(job);
            finished++;
        }

        if (jobs.isEmpty()) {
            checkoutManager.clearAll();
        }

        return finished;
    }

    /**
     * Settle a job whose process exited with code 0.
     */
    public void endJob(SchedulerJob job) {
        Trigger trigger = job.trigger();
        jobRepository.updateStatus(job.jobId(), JobStatus.DONE);

        if (!trigger.isRecurring()) {
            triggerRepository.updateStatus(trigger.id(), TriggerStatus.DONE);
        } else if (!triggerRepository.transition(trigger.id(), TriggerStatus.RUNNING, TriggerStatus.IDLE)) {
            // Paused by an operator while running
            triggerRepository.transition(trigger.id(), TriggerStatus.PAUSING, TriggerStatus.PAUSED);
        }

        log.info("Job {} of '{}' done", job.jobId(), trigger.processName());
        cleanup(job);
    }

    /**
     * Settle a job whose process exited with a non-zero code. The captured
     * standard error becomes an ERROR log row.
     */
    public void failJob(SchedulerJob job, int exitCode) {
        Trigger trigger = job.trigger();
        jobRepository.updateStatus(job.jobId(), JobStatus.FAILED);
        triggerRepository.updateStatus(trigger.id(), TriggerStatus.FAILED);

        String stderr = readStderr(job);
        logRepository.create(trigger.processName(), job.jobId(), LogLevel.ERROR,
                "An uncaught error occurred during the process:\n" + stderr);

        log.warn("Job {} of '{}' failed with exit code {}", job.jobId(), trigger.processName(), exitCode);
        cleanup(job);
    }

    /**
     * Forcibly terminate a tracked job on operator request.
     * The job ends KILLED and its trigger FAILED.
     *
     * @return false if no job with this id is tracked
     */
    public boolean killJob(String jobId) {
        Optional<SchedulerJob> found = jobs.stream().filter(j -> j.jobId().equals(jobId)).findFirst();
        if (found.isEmpty()) {
            return false;
        }

        SchedulerJob job = found.get();
        jobs.remove(job);
        terminate(job);

        Trigger trigger = job.trigger();
        jobRepository.updateStatus(jobId, JobStatus.KILLED);
        triggerRepository.updateStatus(trigger.id(), TriggerStatus.FAILED);
        logRepository.create(trigger.processName(), jobId, LogLevel.ERROR,
                "Job " + jobId + " was killed by an operator");

        log.info("Killed job {} of '{}'", jobId, trigger.processName());
        cleanup(job);
        return true;
    }

    /**
     * Kill every tracked job.
     *
     * @return number of jobs killed
     */
    public int killAll() {
        int killed = 0;
        for (SchedulerJob job : runningJobs()) {
            try {
                if (killJob(job.jobId())) {
                    killed++;
                }
            } catch (Exception e) {
                log.error("Failed to kill job {}", job.jobId(), e);
            }
        }
        return killed;
    }

    private void terminate(SchedulerJob job) {
        Process process = job.process();
        process.destroyForcibly();
        try {
            if (!process.waitFor(killTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Job {} (pid {}) still alive {}ms after kill", job.jobId(), process.pid(),
                        killTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for job {} to die", job.jobId());
        }
    }

    private String readStderr(SchedulerJob job) {
        if (job.stderrFile() == null) {
            return "";
        }
        try {
            return new String(Files.readAllBytes(job.stderrFile()), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.warn("Could not read stderr of job {}: {}", job.jobId(), e.getMessage());
            return "<standard error unavailable>";
        }
    }

    private void cleanup(SchedulerJob job) {
        checkoutManager.delete(job.checkoutFolder());
        if (job.stderrFile() != null) {
            try {
                Files.deleteIfExists(job.stderrFile());
            } catch (IOException e) {
                log.debug("Could not delete {}: {}", job.stderrFile(), e.getMessage());
            }
        }
    }
}
