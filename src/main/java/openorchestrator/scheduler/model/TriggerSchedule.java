package openorchestrator.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Kind-specific part of a {@link Trigger}.
 * The variant decides when a trigger is due and how it is claimed.
 */
public sealed interface TriggerSchedule
        permits TriggerSchedule.SingleSchedule, TriggerSchedule.CronSchedule, TriggerSchedule.QueueSchedule {

    TriggerType type();

    /** Fires once at {@code nextRun}. */
    record SingleSchedule(Instant nextRun) implements TriggerSchedule {
        public SingleSchedule {
            Objects.requireNonNull(nextRun, "nextRun is required");
        }

        @Override
        public TriggerType type() {
            return TriggerType.SINGLE;
        }
    }

    /** Fires at {@code nextRun}, which is advanced along the cron expression on every claim. */
    record CronSchedule(String cronExpr, Instant nextRun) implements TriggerSchedule {
        public CronSchedule {
            Objects.requireNonNull(cronExpr, "cronExpr is required");
            Objects.requireNonNull(nextRun, "nextRun is required");
        }

        @Override
        public TriggerType type() {
            return TriggerType.SCHEDULED;
        }
    }

    /** Fires when at least {@code minBatchSize} NEW elements wait in {@code queueName}. */
    record QueueSchedule(String queueName, int minBatchSize) implements TriggerSchedule {
        public QueueSchedule {
            Objects.requireNonNull(queueName, "queueName is required");
            if (minBatchSize < 1) {
                throw new IllegalArgumentException("minBatchSize must be at least 1");
            }
        }

        @Override
        public TriggerType type() {
            return TriggerType.QUEUE;
        }
    }
}
