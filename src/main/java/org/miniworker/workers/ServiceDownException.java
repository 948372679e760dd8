package org.miniworker.workers;

/**
 * A monitored service did not answer as expected after all retries.
 */
public class ServiceDownException extends Exception {
    private final int httpCode;

    public ServiceDownException(String message, int httpCode) {
        super(message);
        this.httpCode = httpCode;
    }

    public int getHttpCode() {
        return httpCode;
    }
}
