package org.miniworker.manager.exceptions;

public class AlreadyRunningException extends WorkerManagerException {
    private final long pid;

    public AlreadyRunningException(String workerName, long pid) {
        super(workerName, "Worker " + workerName + " is already running (pid " + pid + ")");
        this.pid = pid;
    }

    public long getPid() {
        return pid;
    }
}
