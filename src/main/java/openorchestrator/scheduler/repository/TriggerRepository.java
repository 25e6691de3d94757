package openorchestrator.scheduler.repository;

import openorchestrator.scheduler.model.Trigger;
import openorchestrator.scheduler.model.TriggerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for trigger persistence.
 * Several scheduler instances share one store; the {@code begin*} methods are
 * the only way a trigger moves from IDLE to RUNNING and must be atomic.
 */
public interface TriggerRepository {

    /**
     * Save a new trigger.
     *
     * @param trigger the trigger to save
     */
    void save(Trigger trigger);

    /**
     * Find a trigger by ID.
     *
     * @param triggerId the trigger ID
     * @return the trigger if found
     */
    Optional<Trigger> findById(String triggerId);

    /**
     * All triggers, for operator listings.
     */
    List<Trigger> findAll();

    /**
     * IDLE single triggers with {@code next_run <= now},
     * ordered by priority descending, then next run ascending.
     */
    List<Trigger> findPendingSingle(Instant now);

    /**
     * IDLE scheduled triggers with {@code next_run <= now},
     * ordered by priority descending, then next run ascending.
     */
    List<Trigger> findPendingScheduled(Instant now);

    /**
     * IDLE queue triggers whose queue holds at least {@code min_batch_size} NEW elements,
     * ordered by priority descending, then by the age of the oldest NEW element.
     */
    List<Trigger> findPendingQueue();

    /**
     * Atomically claim a single trigger: IDLE to RUNNING, stamping {@code last_run}.
     *
     * @return true if this caller won the claim
     */
    boolean beginSingle(String triggerId, Instant now);

    /**
     * Atomically claim a scheduled trigger: IDLE to RUNNING, stamping {@code last_run}
     * and moving {@code next_run} forward.
     *
     * @return true if this caller won the claim
     */
    boolean beginScheduled(String triggerId, Instant now, Instant nextRun);

    /**
     * Atomically claim a queue trigger: IDLE to RUNNING, stamping {@code last_run}.
     *
     * @return true if this caller won the claim
     */
    boolean beginQueue(String triggerId, Instant now);

    /**
     * Unconditionally set the status of a trigger.
     *
     * @return true if the trigger exists
     */
    boolean updateStatus(String triggerId, TriggerStatus status);

    /**
     * Set the status only if it currently is {@code expected}.
     *
     * @return true if the transition happened
     */
    boolean transition(String triggerId, TriggerStatus expected, TriggerStatus target);

    /**
     * Operator pause. IDLE triggers become PAUSED at once; RUNNING triggers become
     * PAUSING and are finalised when their job ends.
     *
     * @return the resulting status, or empty if the trigger was in neither state
     */
    Optional<TriggerStatus> requestPause(String triggerId);

    /**
     * Operator re-enable: PAUSED or FAILED back to IDLE.
     *
     * @return true if the trigger was re-enabled
     */
    boolean resume(String triggerId);

    /**
     * Delete a trigger.
     *
     * @return true if a row was removed
     */
    boolean delete(String triggerId);
}
