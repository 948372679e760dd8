package org.miniworker.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.miniworker.manager.LivenessProbe;
import org.miniworker.manager.ProcessTable;
import org.miniworker.manager.SystemProcessTable;
import org.miniworker.monitoring.FileStatusStore;
import org.miniworker.monitoring.StatusFormatter;
import org.miniworker.monitoring.StatusSnapshot;
import org.miniworker.monitoring.StatusStore;
import org.miniworker.utils.JsonUtil;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints the status files of one or all workers in a stats directory.
 */
@Command(name = "status", description = "Show worker status information", mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {

    public enum Format { text, json }

    @Spec
    CommandSpec spec;

    @Option(names = "--stats-dir", defaultValue = ".",
            description = "Directory containing stats files (default: current directory)")
    Path statsDir;

    @Option(names = "--worker-id", description = "Show status for a specific worker ID")
    String workerId;

    @Option(names = "--format", defaultValue = "text",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    Format format;

    ProcessTable processTable = new SystemProcessTable();

    @Override
    public Integer call() throws JsonProcessingException {
        PrintWriter out = spec.commandLine().getOut();
        StatusStore store = new FileStatusStore(statsDir);
        LivenessProbe liveness = new LivenessProbe(store, processTable);

        if (workerId != null) {
            Optional<StatusSnapshot> status = store.read(workerId);
            if (status.isEmpty()) {
                spec.commandLine().getErr().println("No status found for worker '" + workerId + "'");
                return 1;
            }
            boolean running = liveness.isAlive(workerId);
            if (format == Format.json) {
                out.println(JsonUtil.prettyWriter().writeValueAsString(withRunningFlag(status.get(), running)));
            } else {
                printStatus(out, status.get(), running);
            }
            return 0;
        }

        List<String> ids = store.knownWorkerIds();
        if (ids.isEmpty()) {
            out.println("No worker status files found");
            return 0;
        }

        Map<String, Map<String, Object>> all = new LinkedHashMap<>();
        for (String id : ids) {
            Optional<StatusSnapshot> status = store.read(id);
            if (status.isEmpty()) {
                continue;
            }
            boolean running = liveness.isAlive(id);
            if (format == Format.json) {
                all.put(id, withRunningFlag(status.get(), running));
            } else {
                printStatus(out, status.get(), running);
                out.println();
            }
        }
        if (format == Format.json) {
            out.println(JsonUtil.prettyWriter().writeValueAsString(all));
        }
        return 0;
    }

    private static Map<String, Object> withRunningFlag(StatusSnapshot status, boolean running) {
        Map<String, Object> data = JsonUtil.mapper().convertValue(status, new TypeReference<LinkedHashMap<String, Object>>() {});
        data.put("is_running", running);
        return data;
    }

    private static void printStatus(PrintWriter out, StatusSnapshot status, boolean running) {
        out.println("Worker: " + status.workerId());
        String phase = status.status() != null ? status.status().wireName() : "unknown";
        out.println("Status: " + phase + " (" + (running ? "running" : "stopped") + ")");
        out.println("Total Cycles: " + status.totalWorkCycles());
        if (status.lastWorkCycleTime() > 0) {
            out.println(String.format(Locale.ROOT, "Last Cycle: %.2fs", status.lastWorkCycleTime()));
        }
        if (!status.operations().isEmpty()) {
            out.println("Operations:");
            for (String line : StatusFormatter.operationLines(status.operations())) {
                out.println("  " + line);
            }
        }
    }
}
