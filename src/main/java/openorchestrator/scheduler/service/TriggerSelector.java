package openorchestrator.scheduler.service;

import openorchestrator.scheduler.model.LogLevel;
import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerSchedule.CronSchedule;
import openorchestrator.scheduler.model.TriggerStatus;
import openorchestrator.scheduler.repository.LogRepository;
import openorchestrator.scheduler.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the next trigger this machine should run and claims it in the store.
 *
 * Candidates of all three kinds are merged and ordered by:
 * 1. priority, highest first
 * 2. kind: single, then scheduled, then queue
 * 3. the store's due-time order within a kind
 *
 * Candidates are claimed in that order; a claim lost to another scheduler
 * moves on to the next candidate.
 */
public class TriggerSelector {

    private static final Logger log = LoggerFactory.getLogger(TriggerSelector.class);

    private static final Comparator<Trigger> DISPATCH_ORDER = Comparator
            .comparingInt(Trigger::priority).reversed()
            .thenComparingInt(t -> t.type().precedence());

    private final TriggerRepository triggerRepository;
    private final LogRepository logRepository;
    private final CronCalculator cronCalculator;

    public TriggerSelector(TriggerRepository triggerRepository, LogRepository logRepository,
            CronCalculator cronCalculator) {
        this.triggerRepository = triggerRepository;
        this.logRepository = logRepository;
        this.cronCalculator = cronCalculator;
    }

    /**
     * Select and claim the next trigger.
     *
     * @param runningJobs   jobs this scheduler currently tracks
     * @param machineName   name of this scheduler
     * @param exclusiveMode only run triggers that whitelist this machine
     * @return the claimed trigger, re-read after the claim, or empty if nothing is runnable
     */
    public Optional<Trigger> selectNext(List<SchedulerJob> runningJobs, String machineName, boolean exclusiveMode) {
        boolean otherBlockingActive = runningJobs.stream().anyMatch(SchedulerJob::blocking);
        Instant now = Instant.now();

        List<Trigger> candidates = new ArrayList<>();
        candidates.addAll(triggerRepository.findPendingSingle(now));
        candidates.addAll(triggerRepository.findPendingScheduled(now));
        candidates.addAll(triggerRepository.findPendingQueue());

        List<Trigger> eligible = candidates.stream()
                .filter(t -> t.allowsMachine(machineName, exclusiveMode))
                .filter(t -> !(t.blocking() && otherBlockingActive))
                .sorted(DISPATCH_ORDER)
                .toList();

        if (eligible.isEmpty()) {
            log.debug("No eligible triggers ({} pending)", candidates.size());
            return Optional.empty();
        }

        for (Trigger trigger : eligible) {
            if (begin(trigger, now)) {
                log.info("Claimed trigger '{}' ({}, priority {})", trigger.name(), trigger.type(), trigger.priority());
                return Optional.of(reread(trigger));
            }
        }

        log.debug("All {} eligible triggers were claimed elsewhere", eligible.size());
        return Optional.empty();
    }

    /**
     * The claimed trigger as stored. Once claimed it must reach the launcher,
     * so a failed read falls back to the candidate marked RUNNING.
     */
    private Trigger reread(Trigger trigger) {
        Trigger claimed = trigger.toBuilder().status(TriggerStatus.RUNNING).build();
        try {
            return triggerRepository.findById(trigger.id()).orElseGet(() -> {
                log.warn("Claimed trigger '{}' vanished on re-read", trigger.name());
                return claimed;
            });
        } catch (RuntimeException e) {
            log.warn("Could not re-read claimed trigger '{}': {}", trigger.name(), e.getMessage());
            return claimed;
        }
    }

    private boolean begin(Trigger trigger, Instant now) {
        return switch (trigger.type()) {
            case SINGLE -> triggerRepository.beginSingle(trigger.id(), now);
            case SCHEDULED -> beginScheduled(trigger, now);
            case QUEUE -> triggerRepository.beginQueue(trigger.id(), now);
        };
    }

    private boolean beginScheduled(Trigger trigger, Instant now) {
        CronSchedule schedule = (CronSchedule) trigger.schedule();
        Instant nextRun;
        try {
            nextRun = cronCalculator.nextRun(schedule.cronExpr(), now);
        } catch (IllegalArgumentException e) {
            // Never runnable; park it so it stops showing up as pending.
            if (triggerRepository.transition(trigger.id(), TriggerStatus.IDLE, TriggerStatus.FAILED)) {
                log.warn("Trigger '{}' has an invalid cron expression '{}'", trigger.name(), schedule.cronExpr());
                logRepository.create(trigger.processName(), LogLevel.ERROR,
                        "Invalid cron expression '" + schedule.cronExpr() + "': " + e.getMessage());
            }
            return false;
        }
        return triggerRepository.beginScheduled(trigger.id(), now, nextRun);
    }
}
