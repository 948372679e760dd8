package org.miniworker.manager.exceptions;

/**
 * Base type of every failure the worker manager reports to its caller.
 */
public class WorkerManagerException extends RuntimeException {
    private final String workerName;

    public WorkerManagerException(String workerName, String message) {
        super(message);
        this.workerName = workerName;
    }

    public WorkerManagerException(String workerName, String message, Throwable cause) {
        super(message, cause);
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
