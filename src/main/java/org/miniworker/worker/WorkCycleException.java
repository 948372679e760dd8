package org.miniworker.worker;

/**
 * A failed {@code doWork} invocation. Logged by the loop and never rethrown.
 */
public class WorkCycleException extends RuntimeException {

    public WorkCycleException(long cycle, Throwable cause) {
        super("Error in work cycle " + cycle + ": " + cause.getMessage(), cause);
    }
}
