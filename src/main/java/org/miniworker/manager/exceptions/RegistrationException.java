package org.miniworker.manager.exceptions;

public class RegistrationException extends WorkerManagerException {
    public RegistrationException(String workerName, String message, Throwable cause) {
        super(workerName, "Cannot register worker " + workerName + ": " + message, cause);
    }

    public RegistrationException(String workerName, String message) {
        this(workerName, message, null);
    }
}
