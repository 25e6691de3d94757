package openorchestrator.scheduler.service;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Next-run computation for scheduled triggers.
 * Accepts classic five-field unix expressions ({@code "0 0 * * *"}) as well as
 * six-field expressions with a leading seconds field.
 */
public class CronCalculator {

    private final ZoneId zone;

    public CronCalculator() {
        this(ZoneId.systemDefault());
    }

    public CronCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * First instant matching {@code cronExpr} strictly after {@code after}.
     *
     * @throws IllegalArgumentException if the expression is malformed or never fires
     */
    public Instant nextRun(String cronExpr, Instant after) {
        CronExpression expression = parse(cronExpr);
        ZonedDateTime next = expression.next(after.atZone(zone));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression never fires: " + cronExpr);
        }
        return next.toInstant();
    }

    private static CronExpression parse(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String trimmed = cronExpr.trim();
        // Unix cron has no seconds field
        if (trimmed.split("\\s+").length == 5) {
            trimmed = "0 " + trimmed;
        }
        return CronExpression.parse(trimmed);
    }
}
