package org.miniworker.tracking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time copy of the counters kept for one named operation.
 * Times are epoch seconds, durations are seconds.
 */
public record OperationStats(
        @JsonProperty("count") long count,
        @JsonProperty("total_duration") double totalDuration,
        @JsonProperty("start_time") double startTime,
        @JsonProperty("rate_per_hour") double ratePerHour
) {
}
