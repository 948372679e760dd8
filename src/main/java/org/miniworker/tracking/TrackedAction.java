package org.miniworker.tracking;

/**
 * A block of work tracked under an operation name.
 */
@FunctionalInterface
public interface TrackedAction {
    void run() throws Exception;
}
