package openorchestrator.scheduler;

import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerSchedule;

import java.time.Instant;
import java.util.UUID;

/**
 * Trigger builders shared by tests.
 */
public final class TestTriggers {

    private TestTriggers() {
    }

    public static String memoryDbUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static Trigger.Builder single(String name, Instant nextRun) {
        return base(name).schedule(new TriggerSchedule.SingleSchedule(nextRun));
    }

    public static Trigger.Builder scheduled(String name, String cron, Instant nextRun) {
        return base(name).schedule(new TriggerSchedule.CronSchedule(cron, nextRun));
    }

    public static Trigger.Builder queue(String name, String queueName, int minBatchSize) {
        return base(name).schedule(new TriggerSchedule.QueueSchedule(queueName, minBatchSize));
    }

    private static Trigger.Builder base(String name) {
        return Trigger.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .processName(name + "-process")
                .processPath("/does/not/matter/main.py");
    }
}
