package org.miniworker.manager;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.miniworker.monitoring.StatusSnapshot;

/**
 * Supervisor view of one managed worker: liveness from the process table, the
 * statistics from the status store.
 *
 * @param pid       live pid, only when running
 * @param startTime process start in epoch seconds, only when running
 * @param stats     last published snapshot, {@code null} if the worker never reported
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "status", "pid", "start_time", "stats"})
public record WorkerStatusReport(
        @JsonProperty("name") String name,
        @JsonProperty("status") String status,
        @JsonProperty("pid") Long pid,
        @JsonProperty("start_time") Double startTime,
        @JsonProperty("stats") StatusSnapshot stats
) {
    public static final String RUNNING = "running";
    public static final String STOPPED = "stopped";

    public static WorkerStatusReport running(String name, long pid, Double startTime, StatusSnapshot stats) {
        return new WorkerStatusReport(name, RUNNING, pid, startTime, stats);
    }

    public static WorkerStatusReport stopped(String name, StatusSnapshot stats) {
        return new WorkerStatusReport(name, STOPPED, null, null, stats);
    }

    @JsonIgnore
    public boolean isRunning() {
        return RUNNING.equals(status);
    }
}
