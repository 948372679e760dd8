package org.miniworker.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-operation counters for a single worker.
 * <p>
 * Only successful completions are counted. A failed block is logged and rethrown;
 * its elapsed time never reaches the counters. Every successful completion fires
 * the completion listener, which the worker loop uses to publish a fresh status.
 */
public class OperationTracker {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Runnable onCompleted;
    private volatile Logger logger;

    public OperationTracker(Clock clock, Runnable onCompleted) {
        this.clock = clock;
        this.onCompleted = onCompleted;
        this.logger = LoggerFactory.getLogger(OperationTracker.class);
    }

    public OperationTracker(Runnable onCompleted) {
        this(Clock.systemUTC(), onCompleted);
    }

    /**
     * Routes failure logging to the worker's own log sink.
     */
    public void useLogger(Logger workerLogger) {
        this.logger = workerLogger;
    }

    /**
     * Marks the start of one invocation of {@code name}. The first call for a name
     * creates its entry with the current time as the rate baseline.
     */
    public Timing begin(String name) {
        double now = nowSeconds();
        counters.computeIfAbsent(name, n -> new Counter(now));
        return new Timing(name, now);
    }

    /**
     * Closes an invocation opened with {@link #begin(String)}. Must be called once
     * per {@code begin}, on every exit path.
     */
    public void end(Timing timing, boolean success) {
        if (!success) {
            return;
        }
        double now = nowSeconds();
        Counter counter = counters.get(timing.name());
        synchronized (counter) {
            counter.count++;
            counter.totalDuration += now - timing.startedAt();
            double elapsed = now - counter.startTime;
            if (elapsed > 0) {
                counter.ratePerHour = counter.count / (elapsed / SECONDS_PER_HOUR);
            }
        }
        onCompleted.run();
    }

    public void track(String name, TrackedAction action) throws Exception {
        track(name, () -> {
            action.run();
            return null;
        });
    }

    public <T> T track(String name, TrackedOperation<T> operation) throws Exception {
        Timing timing = begin(name);
        boolean success = false;
        try {
            T result = operation.call();
            success = true;
            return result;
        } catch (Exception e) {
            logger.error("Error in operation {}: {}", name, e.getMessage(), e);
            throw e;
        } finally {
            end(timing, success);
        }
    }

    /**
     * Copies of every entry, sorted by operation name.
     */
    public Map<String, OperationStats> snapshot() {
        Map<String, OperationStats> copy = new TreeMap<>();
        counters.forEach((name, counter) -> {
            synchronized (counter) {
                copy.put(name, new OperationStats(counter.count, counter.totalDuration,
                        counter.startTime, counter.ratePerHour));
            }
        });
        return copy;
    }

    public OperationStats stats(String name) {
        return snapshot().get(name);
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    /**
     * Handle returned by {@link #begin(String)}.
     */
    public record Timing(String name, double startedAt) {
    }

    private static final class Counter {
        private final double startTime;
        private long count;
        private double totalDuration;
        private double ratePerHour;

        private Counter(double startTime) {
            this.startTime = startTime;
        }
    }
}
