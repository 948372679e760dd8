package org.miniworker.monitoring;

/**
 * A status file could not be written. Never leaves the {@link StatusStore}.
 */
public class StatusPersistenceException extends RuntimeException {

    public StatusPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
