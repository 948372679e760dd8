package org.miniworker.manager.exceptions;

public class NotRunningException extends WorkerManagerException {
    public NotRunningException(String workerName) {
        super(workerName, "Worker " + workerName + " is not running");
    }
}
