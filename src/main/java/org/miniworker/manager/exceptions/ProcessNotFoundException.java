package org.miniworker.manager.exceptions;

/**
 * The worker looked alive through its pid marker, but no process in the process
 * table carries its command line.
 */
public class ProcessNotFoundException extends WorkerManagerException {
    public ProcessNotFoundException(String workerName, String uniqueId) {
        super(workerName, "Could not find process for worker " + workerName + " (" + uniqueId + ")");
    }
}
