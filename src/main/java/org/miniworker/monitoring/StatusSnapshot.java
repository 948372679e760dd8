package org.miniworker.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.miniworker.tracking.OperationStats;
import org.miniworker.worker.WorkerPhase;

import java.util.Map;
import java.util.TreeMap;

/**
 * Complete, point-in-time status of one worker as published to the status store.
 * This is the schema of {@code <worker_id>.json}.
 */
@JsonPropertyOrder({"worker_id", "status", "total_work_cycles", "total_processing_time",
        "last_work_cycle_time", "last_work_cycle_start", "last_work_cycle_end", "start_time",
        "operations", "timestamp"})
public record StatusSnapshot(
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("status") WorkerPhase status,
        @JsonProperty("total_work_cycles") long totalWorkCycles,
        @JsonProperty("total_processing_time") double totalProcessingTime,
        @JsonProperty("last_work_cycle_time") double lastWorkCycleTime,
        @JsonProperty("last_work_cycle_start") double lastWorkCycleStart,
        @JsonProperty("last_work_cycle_end") double lastWorkCycleEnd,
        @JsonProperty("start_time") Double startTime,
        @JsonProperty("operations") Map<String, OperationStats> operations,
        @JsonProperty("timestamp") double timestamp
) {

    public StatusSnapshot {
        operations = operations == null ? Map.of() : new TreeMap<>(operations);
    }

    public OperationStats operation(String name) {
        return operations.get(name);
    }
}
