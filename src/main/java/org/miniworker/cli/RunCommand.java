package org.miniworker.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.miniworker.config.utils.EnvironmentProvider;
import org.miniworker.utils.JsonUtil;
import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerConfig;
import org.miniworker.worker.WorkerLoop;
import org.miniworker.worker.WorkerTypeException;
import org.miniworker.worker.WorkerTypes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs one worker in the current process until its cycle bound is reached or the
 * process is asked to terminate.
 */
@Command(
        name = "run",
        description = "Run a worker",
        mixinStandardHelpOptions = true,
        footerHeading = "%nExamples:%n",
        footer = {
                "  mini-worker run --worker-class=com.example.MyWorker --wait-seconds=300",
                "  mini-worker run --worker-class=com.example.MyWorker \\",
                "      --worker-params='{\"param1\": \"value1\", \"param2\": 123}' --log-dir=/var/log/workers",
                "  mini-worker run --worker-class=com.example.MyWorker --max-cycles=10"
        }
)
public class RunCommand implements Callable<Integer> {

    /** Console-only config, several worker JVMs must not roll one shared file. */
    static final String RUN_LOGBACK_CONFIG = "logback-run.xml";

    @Spec
    CommandSpec spec;

    @Option(names = "--worker-class", required = true,
            description = "Fully qualified class name of the worker to run")
    String workerClass;

    @Option(names = "--log-dir", description = "Directory for log files (default: current directory)")
    Path logDir;

    @Option(names = "--stats-dir", description = "Directory for stats files (default: same as log-dir)")
    Path statsDir;

    @Option(names = "--wait-seconds", defaultValue = "600",
            description = "Seconds to wait between work cycles (default: ${DEFAULT-VALUE})")
    long waitSeconds;

    @Option(names = "--max-cycles", description = "Maximum number of work cycles before stopping (default: unlimited)")
    Integer maxCycles;

    @Option(names = "--worker-params", defaultValue = "{}",
            description = "JSON object of worker-specific parameters (default: ${DEFAULT-VALUE})")
    String workerParams;

    @Option(names = "--worker-id", description = "Override worker ID (default: use the worker class default)")
    String workerId;

    @Option(names = {"-v", "--verbose"}, description = "Print the effective settings before starting")
    boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Map<String, Object> params;
        try {
            params = parseParams(workerParams);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        Worker worker;
        try {
            worker = WorkerTypes.instantiate(workerClass);
        } catch (WorkerTypeException e) {
            err.println("Error importing worker class '" + workerClass + "': " + e.getMessage());
            err.println("Worker classes must implement " + Worker.class.getName()
                    + " and have a public no-argument constructor");
            return 1;
        }

        WorkerConfig config;
        try {
            config = WorkerConfig.builder()
                    .workerId(workerId)
                    .logDir(logDir)
                    .statsDir(statsDir)
                    .waitSeconds(waitSeconds)
                    .maxCycles(maxCycles)
                    .params(params)
                    .build();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        EnvironmentProvider.init();
        EnvironmentProvider.useLogbackConfig(EnvironmentProvider.isDev() ? "logback-dev.xml" : RUN_LOGBACK_CONFIG);
        WorkerLoop loop = new WorkerLoop(worker, config);

        if (verbose) {
            out.println("Creating worker: " + workerClass);
            out.println("Log directory: " + config.logDir());
            out.println("Stats directory: " + config.statsDir());
            out.println("Wait seconds: " + waitSeconds);
            out.println("Max cycles: " + (maxCycles != null ? maxCycles : "unlimited"));
            out.println("Worker parameters: " + describe(params));
            out.println("Starting worker with ID: " + loop.workerId());
            out.flush();
        }

        loop.run();
        return 0;
    }

    static Map<String, Object> parseParams(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> params = JsonUtil.mapper().readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            return params != null ? params : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in worker params: " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(Map<String, Object> params) {
        try {
            return JsonUtil.prettyWriter().writeValueAsString(params);
        } catch (JsonProcessingException e) {
            return params.toString();
        }
    }
}
