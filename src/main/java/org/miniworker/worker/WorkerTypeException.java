package org.miniworker.worker;

/**
 * A worker class reference that cannot be loaded or is not a usable {@link Worker}.
 */
public class WorkerTypeException extends RuntimeException {
    private final String className;

    public WorkerTypeException(String className, String message) {
        super(message);
        this.className = className;
    }

    public WorkerTypeException(String className, String message, Throwable cause) {
        super(message, cause);
        this.className = className;
    }

    public String getClassName() {
        return className;
    }
}
