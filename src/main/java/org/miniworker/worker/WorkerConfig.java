package org.miniworker.worker;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for one worker run.
 *
 * @param workerId     explicit id, or {@code null} to use {@link Worker#workerId()}
 * @param logDir       directory for {@code <worker_id>.log}
 * @param statsDir     directory for the status files and the pid marker
 * @param waitInterval time between the start of two cycles, zero for back-to-back cycles
 * @param maxCycles    stop after this many cycles, {@code null} for no bound
 * @param params       operator supplied parameters for the worker's own logic
 */
public record WorkerConfig(
        String workerId,
        Path logDir,
        Path statsDir,
        Duration waitInterval,
        Integer maxCycles,
        Map<String, Object> params,
        boolean installShutdownHook
) {

    public static final Duration DEFAULT_WAIT = Duration.ofSeconds(600);

    public WorkerConfig {
        Objects.requireNonNull(logDir, "logDir");
        Objects.requireNonNull(statsDir, "statsDir");
        Objects.requireNonNull(waitInterval, "waitInterval");
        if (waitInterval.isNegative()) {
            throw new IllegalArgumentException("waitInterval must not be negative: " + waitInterval);
        }
        if (maxCycles != null && maxCycles < 0) {
            throw new IllegalArgumentException("maxCycles must not be negative: " + maxCycles);
        }
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String workerId;
        private Path logDir;
        private Path statsDir;
        private Duration waitInterval = DEFAULT_WAIT;
        private Integer maxCycles;
        private Map<String, Object> params = Map.of();
        private boolean installShutdownHook = true;

        private Builder() {}

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder logDir(Path logDir) {
            this.logDir = logDir;
            return this;
        }

        public Builder statsDir(Path statsDir) {
            this.statsDir = statsDir;
            return this;
        }

        public Builder waitInterval(Duration waitInterval) {
            this.waitInterval = waitInterval;
            return this;
        }

        public Builder waitSeconds(long seconds) {
            return waitInterval(Duration.ofSeconds(seconds));
        }

        public Builder maxCycles(Integer maxCycles) {
            this.maxCycles = maxCycles;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder installShutdownHook(boolean installShutdownHook) {
            this.installShutdownHook = installShutdownHook;
            return this;
        }

        /**
         * Log dir defaults to the working directory, stats dir to the log dir.
         */
        public WorkerConfig build() {
            Path logs = logDir != null ? logDir : Path.of("").toAbsolutePath();
            Path stats = statsDir != null ? statsDir : logs;
            return new WorkerConfig(workerId, logs, stats, waitInterval, maxCycles, params, installShutdownHook);
        }
    }
}
