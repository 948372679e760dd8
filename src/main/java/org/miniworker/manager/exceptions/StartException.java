package org.miniworker.manager.exceptions;

/**
 * The worker process could not be spawned. The cause holds the underlying error.
 */
public class StartException extends WorkerManagerException {
    public StartException(String workerName, Throwable cause) {
        super(workerName, "Failed to start worker " + workerName + ": " + cause.getMessage(), cause);
    }
}
