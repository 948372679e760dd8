package org.miniworker.monitoring;

import org.miniworker.tracking.OperationStats;
import org.miniworker.utils.DurationFormatter;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable renderings of a {@link StatusSnapshot}.
 */
public final class StatusFormatter {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private StatusFormatter() {}

    /**
     * Content of the {@code <worker_id>.stats} file.
     */
    public static String format(StatusSnapshot status) {
        List<String> lines = new ArrayList<>();

        lines.add("Worker ID: " + (status.workerId() != null ? status.workerId() : "unknown"));
        lines.add("Status: " + (status.status() != null ? status.status().wireName() : "unknown"));
        lines.add("Total Cycles: " + status.totalWorkCycles());

        if (status.lastWorkCycleTime() > 0) {
            lines.add(String.format(Locale.ROOT, "Last Cycle Duration: %.2fs", status.lastWorkCycleTime()));
        }
        if (status.totalProcessingTime() > 0) {
            double avg = status.totalProcessingTime() / Math.max(1, status.totalWorkCycles());
            lines.add(String.format(Locale.ROOT, "Average Cycle Time: %.2fs", avg));
            lines.add("Total Processing Time: " + DurationFormatter.format(status.totalProcessingTime()));
        }
        if (status.startTime() != null) {
            lines.add("Started: " + formatTimestamp(status.startTime()));
        }

        if (!status.operations().isEmpty()) {
            lines.add("");
            lines.add("Operations:");
            for (String line : operationLines(status.operations())) {
                lines.add("  " + line);
            }
        }

        if (status.timestamp() > 0) {
            lines.add("");
            lines.add("Last Updated: " + formatTimestamp(status.timestamp()));
        }
        return String.join("\n", lines);
    }

    /**
     * One line per operation, or a placeholder when nothing has completed yet.
     */
    public static String operationSummary(Map<String, OperationStats> operations) {
        if (operations.isEmpty()) {
            return "No operations completed yet";
        }
        return String.join("\n", operationLines(operations));
    }

    public static List<String> operationLines(Map<String, OperationStats> operations) {
        List<String> lines = new ArrayList<>();
        operations.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> lines.add(String.format(Locale.ROOT, "%s: %.1f/hour (%d total)",
                        e.getKey(), e.getValue().ratePerHour(), e.getValue().count())));
        return lines;
    }

    public static String formatTimestamp(double epochSeconds) {
        return TIMESTAMP.format(Instant.ofEpochMilli((long) (epochSeconds * 1000)));
    }
}
