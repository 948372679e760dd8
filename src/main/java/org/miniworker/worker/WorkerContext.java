package org.miniworker.worker;

import org.miniworker.tracking.OperationTracker;
import org.miniworker.tracking.TrackedAction;
import org.miniworker.tracking.TrackedOperation;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * What a running worker can see of the framework: its id, its log sink,
 * its parameters and operation tracking.
 */
public class WorkerContext {

    private final String workerId;
    private final Logger logger;
    private final WorkerConfig config;
    private final OperationTracker tracker;
    private final BooleanSupplier shutdownRequested;

    public WorkerContext(String workerId, Logger logger, WorkerConfig config,
                         OperationTracker tracker, BooleanSupplier shutdownRequested) {
        this.workerId = workerId;
        this.logger = logger;
        this.config = config;
        this.tracker = tracker;
        this.shutdownRequested = shutdownRequested;
    }

    public String workerId() {
        return workerId;
    }

    public Logger logger() {
        return logger;
    }

    public WorkerConfig config() {
        return config;
    }

    public Map<String, Object> params() {
        return config.params();
    }

    /**
     * True once a stop was requested. Long running work may poll this to return early.
     */
    public boolean isShutdownRequested() {
        return shutdownRequested.getAsBoolean();
    }

    /**
     * Runs {@code action} under the operation {@code name}. Only successful runs are
     * counted; a failure is logged and rethrown.
     */
    public void trackOperation(String name, TrackedAction action) throws Exception {
        tracker.track(name, action);
    }

    public <T> T trackResult(String name, TrackedOperation<T> operation) throws Exception {
        return tracker.track(name, operation);
    }

    /**
     * Same as {@link #trackOperation}; kept for workers ported from older bases.
     */
    public void calcOne(String name, TrackedAction action) throws Exception {
        tracker.track(name, action);
    }

    // --- Parameter access ---

    public String stringParam(String key, String defaultValue) {
        Object value = params().get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int intParam(String key, int defaultValue) {
        Object value = params().get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString().trim());
    }

    public long longParam(String key, long defaultValue) {
        Object value = params().get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString().trim());
    }

    public double doubleParam(String key, double defaultValue) {
        Object value = params().get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString().trim());
    }

    public boolean booleanParam(String key, boolean defaultValue) {
        Object value = params().get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString().trim());
    }

    public List<String> stringListParam(String key, List<String> defaultValue) {
        Object value = params().get(key);
        if (value == null) return defaultValue;
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(value.toString().split("\\s*,\\s*"));
    }
}
