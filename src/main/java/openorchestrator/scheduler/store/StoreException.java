package openorchestrator.scheduler.store;

/**
 * Unchecked failure of a store operation. Wraps the underlying SQL or
 * serialization error and names the operation that failed.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
