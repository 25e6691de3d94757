package openorchestrator.scheduler.service;

/**
 * A trigger's process could not be started: the checkout failed, the entry
 * point is missing or invalid, or the child process could not be spawned.
 */
public class LaunchException extends Exception {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
