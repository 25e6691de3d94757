package openorchestrator.scheduler.repository;

import openorchestrator.scheduler.model.QueueElement;
import openorchestrator.scheduler.model.QueueElementStatus;

/**
 * Repository interface for queue elements.
 */
public interface QueueRepository {

    /**
     * Add a NEW element to a queue.
     */
    QueueElement enqueue(String queueName, String reference, String data, String createdBy);

    /**
     * Number of NEW elements in a queue.
     */
    int countNew(String queueName);

    boolean updateStatus(String elementId, QueueElementStatus status);
}
