package openorchestrator.scheduler.service;

import openorchestrator.scheduler.config.SchedulerConfig;
import openorchestrator.scheduler.model.Job;
import openorchestrator.scheduler.model.JobStatus;
import openorchestrator.scheduler.model.LogLevel;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.repository.JobRepository;
import openorchestrator.scheduler.repository.LogRepository;
import openorchestrator.scheduler.repository.SchedulerRepository;
import openorchestrator.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Starts the process of a claimed trigger.
 *
 * The child is invoked as
 * {@code <runtime> <entry point> <process name> <connection string> <crypto key> <args> <trigger id> <job id>}.
 * Its standard output is inherited; standard error goes to a capture file that
 * the supervisor reads if the process fails.
 */
public class ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessLauncher.class);

    private final SchedulerConfig config;
    private final TriggerRepository triggerRepository;
    private final JobRepository jobRepository;
    private final LogRepository logRepository;
    private final SchedulerRepository schedulerRepository;
    private final CheckoutManager checkoutManager;

    public ProcessLauncher(SchedulerConfig config,
            TriggerRepository triggerRepository,
            JobRepository jobRepository,
            LogRepository logRepository,
            SchedulerRepository schedulerRepository,
            CheckoutManager checkoutManager) {
        this.config = config;
        this.triggerRepository = triggerRepository;
        this.jobRepository = jobRepository;
        this.logRepository = logRepository;
        this.schedulerRepository = schedulerRepository;
        this.checkoutManager = checkoutManager;
    }

    /**
     * Launch the trigger's process. Never throws: on any failure the trigger is
     * marked FAILED, an ERROR log row is written and empty is returned.
     */
    public Optional<SchedulerJob> launch(Trigger trigger) {
        Path checkoutFolder = null;
        Path stderrFile = null;
        Job job = null;

        try {
            Path entryPoint;
            if (trigger.gitRepo()) {
                checkoutFolder = checkoutManager.checkout(trigger.processPath(), trigger.gitBranch());
                entryPoint = checkoutManager.findEntryPoint(checkoutFolder, config.entryPointName())
                        .orElseThrow(() -> new LaunchException(
                                "No " + config.entryPointName() + " found in " + trigger.processPath()));
            } else {
                entryPoint = Path.of(trigger.processPath());
            }
            validate(entryPoint);

            job = jobRepository.start(trigger.processName(), config.machineName());

            stderrFile = Files.createTempFile("openorchestrator-" + job.id() + "-", ".stderr");
            Process process = new ProcessBuilder(command(trigger, entryPoint, job))
                    .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                    .redirectError(stderrFile.toFile())
                    .start();

            log.info("Launched '{}' (trigger '{}', job {}, pid {})",
                    trigger.processName(), trigger.name(), job.id(), process.pid());

            try {
                schedulerRepository.recordTriggerStart(config.machineName(), trigger.name());
            } catch (RuntimeException e) {
                log.warn("Could not record start of trigger '{}': {}", trigger.name(), e.getMessage());
            }

            return Optional.of(new SchedulerJob(process, trigger, job, checkoutFolder, stderrFile));

        } catch (LaunchException | IOException | RuntimeException e) {
            handleFailure(trigger, job, checkoutFolder, stderrFile, e);
            return Optional.empty();
        }
    }

    private void validate(Path entryPoint) throws LaunchException {
        if (!Files.isRegularFile(entryPoint)) {
            throw new LaunchException("Process file does not exist: " + entryPoint);
        }
        if (!entryPoint.getFileName().toString().endsWith(config.processExtension())) {
            throw new LaunchException("Process file must end with " + config.processExtension() + ": " + entryPoint);
        }
    }

    private List<String> command(Trigger trigger, Path entryPoint, Job job) {
        return List.of(
                config.processRuntime(),
                entryPoint.toString(),
                trigger.processName(),
                Objects.toString(config.connectionString(), ""),
                Objects.toString(config.cryptoKey(), ""),
                trigger.processArgs(),
                trigger.id(),
                job.id());
    }

    private void handleFailure(Trigger trigger, Job job, Path checkoutFolder, Path stderrFile, Exception e) {
        log.warn("Could not launch '{}' (trigger '{}'): {}", trigger.processName(), trigger.name(), e.toString());

        String message = "Scheduler couldn't launch the process:\n"
                + e.getClass().getSimpleName() + ":\n" + e.getMessage();

        try {
            triggerRepository.updateStatus(trigger.id(), TriggerStatus.FAILED);
            if (job != null) {
                jobRepository.updateStatus(job.id(), JobStatus.FAILED);
            }
            logRepository.create(trigger.processName(), job != null ? job.id() : null, LogLevel.ERROR, message);
        } catch (RuntimeException storeError) {
            log.error("Could not record launch failure of trigger '{}'", trigger.name(), storeError);
        }

        checkoutManager.delete(checkoutFolder);
        if (stderrFile != null) {
            try {
                Files.deleteIfExists(stderrFile);
            } catch (IOException io) {
                log.debug("Could not delete {}: {}", stderrFile, io.getMessage());
            }
        }
    }
}
