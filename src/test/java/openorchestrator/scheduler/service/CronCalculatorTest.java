package openorchestrator.scheduler.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CronCalculatorTest {

    private final CronCalculator cron = new CronCalculator(ZoneOffset.UTC);

    @Test
    @DisplayName("Five-field daily expression fires at the next midnight")
    void nextMidnight() {
        Instant after = Instant.parse("2024-03-05T10:15:30Z");
        assertEquals(Instant.parse("2024-03-06T00:00:00Z"), cron.nextRun("0 0 * * *", after));
    }

    @Test
    void strictlyAfter() {
        Instant midnight = Instant.parse("2024-03-06T00:00:00Z");
        assertEquals(Instant.parse("2024-03-07T00:00:00Z"), cron.nextRun("0 0 * * *", midnight));
    }

    @Test
    void everyMinute() {
        Instant after = Instant.parse("2024-03-05T10:15:30Z");
        assertEquals(Instant.parse("2024-03-05T10:16:00Z"), cron.nextRun("* * * * *", after));
    }

    @Test
    void sixFieldExpressionsKeepSeconds() {
        Instant after = Instant.parse("2024-03-05T10:15:31Z");
        assertEquals(Instant.parse("2024-03-05T10:15:40Z"), cron.nextRun("*/10 * * * * *", after));
    }

    @Test
    void weekdays() {
        // 2024-03-08 is a Friday
        Instant friday = Instant.parse("2024-03-08T09:00:00Z");
        assertEquals(Instant.parse("2024-03-11T08:30:00Z"), cron.nextRun("30 8 * * MON-FRI", friday));
    }

    @Test
    void invalidExpressions() {
        assertThrows(IllegalArgumentException.class, () -> cron.nextRun("not a cron", Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> cron.nextRun("", Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> cron.nextRun("61 * * * *", Instant.now()));
        assertThrows(IllegalArgumentException.class, () -> cron.nextRun(null, Instant.now()));
    }
}
