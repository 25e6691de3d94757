package openorchestrator.scheduler.repository;

import openorchestrator.scheduler.model.SchedulerHeartbeat;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for scheduler heartbeats.
 */
public interface SchedulerRepository {

    /**
     * Create or refresh the heartbeat row of a machine.
     */
    void ping(String machineName);

    /**
     * Refresh the heartbeat and note the trigger this machine just started.
     */
    void recordTriggerStart(String machineName, String triggerName);

    Optional<SchedulerHeartbeat> findByName(String machineName);

    List<SchedulerHeartbeat> findAll();
}
