package openorchestrator.scheduler.store;

import openorchestrator.scheduler.TestTriggers;
import openorchestrator.scheduler.model.Job;
import openorchestrator.scheduler.model.JobStatus;
import openorchestrator.scheduler.model.LogEntry;
import openorchestrator.scheduler.model.LogLevel;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcLogRepository logs;
    private static JdbcSchedulerRepository schedulers;

    @BeforeAll
    static void setup() {
        db = new Database(TestTriggers.memoryDbUrl("jobs"), 4);
        jobs = new JdbcJobRepository(db);
        logs = new JdbcLogRepository(db);
        schedulers = new JdbcSchedulerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            st.execute("DELETE FROM logs");
            st.execute("DELETE FROM schedulers");
            conn.commit();
        }
    }

    @Test
    void startCreatesRunningJob() {
        Job job = jobs.start("report", "host-a");

        Job found = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.RUNNING, found.status());
        assertEquals("report", found.processName());
        assertEquals("host-a", found.schedulerName());
        assertNotNull(found.startTime());
        assertNull(found.endTime());
    }

    @Test
    @DisplayName("end_time is stamped by the first terminal status and never changes")
    void endTimeStampedOnce() throws Exception {
        Job job = jobs.start("report", "host-a");

        assertTrue(jobs.updateStatus(job.id(), JobStatus.DONE));
        Instant firstEnd = jobs.findById(job.id()).orElseThrow().endTime();
        assertNotNull(firstEnd);

        Thread.sleep(20);
        assertFalse(jobs.updateStatus(job.id(), JobStatus.FAILED));

        Job after = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.DONE, after.status());
        assertEquals(firstEnd, after.endTime());
    }

    @Test
    void updateMissingJob() {
        assertFalse(jobs.updateStatus("missing", JobStatus.KILLED));
    }

    @Test
    void findRecentNewestFirst() throws Exception {
        Job first = jobs.start("a", "host-a");
        Thread.sleep(10);
        Job second = jobs.start("b", "host-a");

        List<Job> recent = jobs.findRecent(10);
        assertEquals(List.of(second.id(), first.id()), recent.stream().map(Job::id).toList());
    }

    @Test
    void logRowsAreStoredAndTruncated() {
        logs.create("report", LogLevel.INFO, "hello");
        logs.create("report", "job-1", LogLevel.ERROR, "x".repeat(9000));
        logs.create("other", LogLevel.TRACE, "ignored");

        List<LogEntry> entries = logs.findByProcess("report", 10);
        assertEquals(2, entries.size());
        LogEntry error = entries.stream().filter(e -> e.level() == LogLevel.ERROR).findFirst().orElseThrow();
        assertEquals("job-1", error.jobId());
        assertEquals(8000, error.message().length());
        assertEquals(3, logs.findRecent(10).size());
    }

    @Test
    void heartbeatUpserts() {
        schedulers.ping("host-a");
        schedulers.ping("host-a");
        schedulers.recordTriggerStart("host-a", "nightly");

        assertEquals(1, schedulers.findAll().size());
        var heartbeat = schedulers.findByName("host-a").orElseThrow();
        assertEquals("nightly", heartbeat.latestTrigger());
        assertNotNull(heartbeat.lastTriggerStart());
        assertNotNull(heartbeat.lastUpdate());

        schedulers.ping("host-a");
        assertEquals("nightly", schedulers.findByName("host-a").orElseThrow().latestTrigger(),
                "a plain ping keeps the last trigger");
    }
}
