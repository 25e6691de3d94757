package openorchestrator.scheduler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

    private static Trigger.Builder base() {
        return Trigger.builder()
                .id("t-1")
                .name("nightly")
                .processName("report")
                .processPath("/opt/report/main.py")
                .schedule(new TriggerSchedule.SingleSchedule(Instant.now()));
    }

    @Test
    void defaults() {
        Trigger trigger = base().build();

        assertEquals(TriggerStatus.IDLE, trigger.status());
        assertEquals("", trigger.processArgs());
        assertTrue(trigger.schedulerWhitelist().isEmpty());
        assertEquals(TriggerType.SINGLE, trigger.type());
        assertFalse(trigger.isRecurring());
    }

    @Test
    void missingRequiredFieldIsRejected() {
        assertThrows(NullPointerException.class, () -> base().schedule(null).build());
        assertThrows(NullPointerException.class, () -> base().processName(null).build());
    }

    @Test
    @DisplayName("Empty whitelist: any machine, unless exclusive")
    void emptyWhitelist() {
        Trigger trigger = base().build();

        assertTrue(trigger.allowsMachine("host-a", false));
        assertFalse(trigger.allowsMachine("host-a", true));
    }

    @Test
    @DisplayName("Non-empty whitelist: only listed machines, exclusive or not")
    void nonEmptyWhitelist() {
        Trigger trigger = base().schedulerWhitelist(List.of("host-a")).build();

        assertTrue(trigger.allowsMachine("host-a", false));
        assertTrue(trigger.allowsMachine("host-a", true));
        assertFalse(trigger.allowsMachine("host-b", false));
        assertFalse(trigger.allowsMachine("host-b", true));
    }

    @Test
    void recurringKinds() {
        Trigger scheduled = base().schedule(new TriggerSchedule.CronSchedule("0 0 * * *", Instant.now())).build();
        Trigger queue = base().schedule(new TriggerSchedule.QueueSchedule("invoices", 1)).build();

        assertTrue(scheduled.isRecurring());
        assertTrue(queue.isRecurring());
        assertEquals(TriggerType.SCHEDULED, scheduled.type());
        assertEquals(TriggerType.QUEUE, queue.type());
    }

    @Test
    void queueBatchSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TriggerSchedule.QueueSchedule("q", 0));
    }

    @Test
    void kindPrecedence() {
        assertTrue(TriggerType.SINGLE.precedence() < TriggerType.SCHEDULED.precedence());
        assertTrue(TriggerType.SCHEDULED.precedence() < TriggerType.QUEUE.precedence());
    }

    @Test
    void toBuilderKeepsFields() {
        Trigger trigger = base().priority(7).blocking(true).schedulerWhitelist(List.of("x")).build();
        Trigger copy = trigger.toBuilder().status(TriggerStatus.RUNNING).build();

        assertEquals(trigger, copy);
        assertEquals(7, copy.priority());
        assertTrue(copy.blocking());
        assertEquals(List.of("x"), copy.schedulerWhitelist());
        assertEquals(TriggerStatus.RUNNING, copy.status());
    }
}
