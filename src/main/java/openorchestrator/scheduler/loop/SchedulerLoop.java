package openorchestrator.scheduler.loop;

import openorchestrator.scheduler.config.SchedulerConfig;
import openorchestrator.scheduler.repository.SchedulerRepository;
import openorchestrator.scheduler.service.JobSupervisor;
import openorchestrator.scheduler.service.ProcessLauncher;
import openorchestrator.scheduler.service.TriggerSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The scheduler's heartbeat. Each tick:
 * 1. pings the store with this machine's name
 * 2. reconciles finished processes
 * 3. if running, selects, launches and tracks at most one trigger
 *
 * The next tick is scheduled only while the scheduler is running or still
 * tracks jobs. All work happens on one thread, so the tracked set needs no locking.
 */
public class SchedulerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final SchedulerConfig config;
    private final OperatingMode mode;
    private final SchedulerRepository schedulerRepository;
    private final TriggerSelector selector;
    private final ProcessLauncher launcher;
    private final JobSupervisor supervisor;
    private final ScheduledExecutorService executor;

    // Guarded by this
    private ScheduledFuture<?> pending;
    private boolean closed;

    public SchedulerLoop(SchedulerConfig config,
            OperatingMode mode,
            SchedulerRepository schedulerRepository,
            TriggerSelector selector,
            ProcessLauncher launcher,
            JobSupervisor supervisor) {
        this.config = config;
        this.mode = mode;
        this.schedulerRepository = schedulerRepository;
        this.selector = selector;
        this.launcher = launcher;
        this.supervisor = supervisor;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "openorchestrator-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start picking up triggers.
     *
     * @throws IllegalStateException if no connection string or crypto key is configured,
     *                               or the loop has been closed
     */
    public synchronized void run() {
        if (closed) {
            throw new IllegalStateException("Scheduler loop is closed");
        }
        if (config.connectionString() == null || config.connectionString().isBlank()) {
            throw new IllegalStateException("Connection string is not set");
        }
        if (!config.hasCryptoKey()) {
            throw new IllegalStateException("Crypto key is not set");
        }

        mode.setRunning(true);
        log.info("Scheduler '{}' running", config.machineName());

        if (pending == null || pending.isDone()) {
            pending = executor.schedule(this::tickAndReschedule, 0, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stop picking up new triggers. Jobs already running keep being supervised
     * until they finish.
     */
    public void pause() {
        mode.setRunning(false);
        log.info("Scheduler '{}' paused ({} jobs still running)", config.machineName(), supervisor.runningJobs().size());
    }

    public void setExclusive(boolean exclusive) {
        mode.setExclusive(exclusive);
        log.info("Exclusive mode {}", exclusive ? "on" : "off");
    }

    public OperatingMode mode() {
        return mode;
    }

    public JobSupervisor supervisor() {
        return supervisor;
    }

    /**
     * Kill a tracked job on the loop thread.
     *
     * @return completes with false if the job is not tracked by this scheduler
     */
    public CompletableFuture<Boolean> killJob(String jobId) {
        return CompletableFuture.supplyAsync(() -> supervisor.killJob(jobId), executor);
    }

    /**
     * Run one tick. Never throws.
     */
    public void tick() {
        try {
            schedulerRepository.ping(config.machineName());
        } catch (Exception e) {
            log.error("Heartbeat failed", e);
        }

        try {
            supervisor.reconcile();
        } catch (Exception e) {
            log.error("Job reconciliation failed", e);
        }

        if (!mode.isRunning()) {
            return;
        }

        try {
            selector.selectNext(supervisor.runningJobs(), config.machineName(), mode.isExclusive())
                    .flatMap(launcher::launch)
                    .ifPresent(supervisor::track);
        } catch (Exception e) {
            log.error("Trigger dispatch failed", e);
        }
    }

    private void tickAndReschedule() {
        tick();
        synchronized (this) {
            if (closed) {
                return;
            }
            if (mode.isRunning() || !supervisor.isEmpty()) {
                pending = executor.schedule(this::tickAndReschedule,
                        config.tickInterval().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                pending = null;
                log.info("Scheduler idle");
            }
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            mode.setRunning(false);
            if (pending != null) {
                pending.cancel(false);
            }
        }

        if (config.killJobsOnShutdown()) {
            try {
                int killed = CompletableFuture.supplyAsync(supervisor::killAll, executor)
                        .get(config.killTimeout().toMillis() + 5000, TimeUnit.MILLISECONDS);
                log.info("Killed {} jobs on shutdown", killed);
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Could not kill jobs on shutdown: {}", e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else if (!supervisor.isEmpty()) {
            log.warn("Shutting down with {} jobs still running", supervisor.runningJobs().size());
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler loop forcefully stopped");
            } else {
                log.info("Scheduler loop stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
