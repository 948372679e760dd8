package org.miniworker.manager.exceptions;

import java.util.List;

public class UnknownWorkerException extends WorkerManagerException {
    public UnknownWorkerException(String workerName, List<String> available) {
        super(workerName, "Unknown worker: " + workerName + ". Available workers: " + available);
    }
}
