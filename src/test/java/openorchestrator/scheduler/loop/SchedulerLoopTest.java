package openorchestrator.scheduler.loop;

import openorchestrator.scheduler.TestTriggers;
import openorchestrator.scheduler.config.SchedulerConfig;
import openorchestrator.scheduler.model.JobStatus;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerSchedule;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.service.*;
import openorchestrator.scheduler.store.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerLoopTest {

    private static final String MACHINE = "loop-host";

    @TempDir
    Path tmp;

    private Database db;
    private JdbcTriggerRepository triggers;
    private JdbcJobRepository jobs;
    private JdbcSchedulerRepository schedulers;
    private OperatingMode mode;
    private JobSupervisor supervisor;
    private SchedulerLoop loop;

    private SchedulerLoop build(SchedulerConfig config) {
        db = new Database(config);
        triggers = new JdbcTriggerRepository(db);
        jobs = new JdbcJobRepository(db);
        JdbcLogRepository logs = new JdbcLogRepository(db);
        schedulers = new JdbcSchedulerRepository(db);
        CheckoutManager checkouts = new CheckoutManager(config);

        mode = new OperatingMode();
        supervisor = new JobSupervisor(config, triggers, jobs, logs, checkouts);
        TriggerSelector selector = new TriggerSelector(triggers, logs, new CronCalculator());
        ProcessLauncher launcher = new ProcessLauncher(config, triggers, jobs, logs, schedulers, checkouts);
        return new SchedulerLoop(config, mode, schedulers, selector, launcher, supervisor);
    }

    private SchedulerConfig config() {
        return SchedulerConfig.defaults()
                .withDatabaseUrl(TestTriggers.memoryDbUrl("loop"))
                .withMachineName(MACHINE)
                .withCryptoKey("key")
                .withProcessRuntime("sh")
                .withEntryPoint("main.sh", ".sh")
                .withTickInterval(Duration.ofMillis(100))
                .withKillJobsOnShutdown(true)
                .withCheckoutRoot(tmp.resolve("repos"));
    }

    @BeforeEach
    void setUp() {
        loop = build(config());
    }

    @AfterEach
    void tearDown() {
        loop.close();
        db.close();
    }

    private Path script(String body) throws Exception {
        Path dir = tmp.resolve("proc-" + System.nanoTime());
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve("main.sh"), body);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(50);
        }
    }

    @Test
    void runRequiresCryptoKey() {
        loop.close();
        db.close();
        loop = build(config().withCryptoKey(null));

        IllegalStateException e = assertThrows(IllegalStateException.class, loop::run);
        assertTrue(e.getMessage().contains("Crypto key"));
        assertFalse(mode.isRunning());
    }

    @Test
    void pausedTickOnlyPings() throws Exception {
        Trigger trigger = TestTriggers.single("ready", Instant.now().minusSeconds(5))
                .processPath(script("exit 0\n").toString()).build();
        triggers.save(trigger);

        loop.tick();

        assertTrue(schedulers.findByName(MACHINE).isPresent());
        assertEquals(TriggerStatus.IDLE, triggers.findById(trigger.id()).orElseThrow().status());
        assertTrue(supervisor.isEmpty());
    }

    @Test
    @DisplayName("Tick launches one trigger; a later tick settles it")
    void tickLaunchesAndSettles() throws Exception {
        Trigger first = TestTriggers.single("first", Instant.now().minusSeconds(5)).priority(5)
                .processPath(script("exit 0\n").toString()).build();
        Trigger second = TestTriggers.single("second", Instant.now().minusSeconds(5))
                .processPath(script("exit 0\n").toString()).build();
        triggers.save(first);
        triggers.save(second);
        mode.setRunning(true);

        loop.tick();
        assertEquals(1, supervisor.runningJobs().size());
        SchedulerJob job = supervisor.runningJobs().get(0);
        assertEquals(first.id(), job.trigger().id());
        assertEquals(TriggerStatus.IDLE, triggers.findById(second.id()).orElseThrow().status());

        assertTrue(job.process().waitFor(10, TimeUnit.SECONDS));
        mode.setRunning(false);
        loop.tick();

        assertTrue(supervisor.isEmpty());
        assertEquals(TriggerStatus.DONE, triggers.findById(first.id()).orElseThrow().status());
        assertEquals(JobStatus.DONE, jobs.findById(job.jobId()).orElseThrow().status());
    }

    @Test
    @DisplayName("Running loop drives a scheduled trigger through a full run")
    void scheduledRecurrence() throws Exception {
        Instant due = Instant.now().minusSeconds(5);
        Trigger trigger = TestTriggers.scheduled("every-minute", "* * * * *", due)
                .processPath(script("exit 0\n").toString()).build();
        triggers.save(trigger);

        loop.run();

        await(() -> triggers.findById(trigger.id()).orElseThrow().lastRun() != null
                && triggers.findById(trigger.id()).orElseThrow().status() == TriggerStatus.IDLE
                && supervisor.isEmpty(),
                "scheduled trigger did not complete a run");
        loop.pause();

        Trigger after = triggers.findById(trigger.id()).orElseThrow();
        Instant nextRun = ((TriggerSchedule.CronSchedule) after.schedule()).nextRun();
        assertTrue(nextRun.isAfter(Instant.now()), "next run moved into the future");
        assertEquals(1, jobs.findRecent(10).size());
        assertEquals(JobStatus.DONE, jobs.findRecent(10).get(0).status());
    }

    @Test
    void killJobRunsOnLoopThread() throws Exception {
        Trigger trigger = TestTriggers.single("stuck", Instant.now().minusSeconds(5))
                .processPath(script("exec sleep 30\n").toString()).build();
        triggers.save(trigger);
        mode.setRunning(true);
        loop.tick();
        String jobId = supervisor.runningJobs().get(0).jobId();

        assertTrue(loop.killJob(jobId).get(10, TimeUnit.SECONDS));
        assertFalse(loop.killJob(jobId).get(10, TimeUnit.SECONDS));
        assertEquals(JobStatus.KILLED, jobs.findById(jobId).orElseThrow().status());
    }

    @Test
    void closeKillsJobsWhenConfigured() throws Exception {
        Trigger trigger = TestTriggers.single("stuck", Instant.now().minusSeconds(5))
                .processPath(script("exec sleep 30\n").toString()).build();
        triggers.save(trigger);
        mode.setRunning(true);
        loop.tick();
        SchedulerJob job = supervisor.runningJobs().get(0);

        loop.close();

        assertFalse(job.process().isAlive());
        assertEquals(JobStatus.KILLED, jobs.findById(job.jobId()).orElseThrow().status());
        assertThrows(IllegalStateException.class, loop::run);
    }
}
