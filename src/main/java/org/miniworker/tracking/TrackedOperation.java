package org.miniworker.tracking;

/**
 * Tracked block that produces a value.
 */
@FunctionalInterface
public interface TrackedOperation<T> {
    T call() throws Exception;
}
