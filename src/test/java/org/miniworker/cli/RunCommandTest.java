package org.miniworker.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.miniworker.Main;
import org.miniworker.monitoring.FileStatusStore;
import org.miniworker.monitoring.StatusSnapshot;
import org.miniworker.testing.TestWorkers;
import org.miniworker.worker.WorkerPhase;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        cli = Main.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @Test
    void runsTheWorkerForTheRequestedCycles() {
        int exit = cli.execute("run",
                "--worker-class", TestWorkers.NoopWorker.class.getName(),
                "--worker-id", "cli_noop",
                "--log-dir", dir.resolve("logs").toString(),
                "--stats-dir", dir.resolve("stats").toString(),
                "--wait-seconds", "0",
                "--max-cycles", "2",
                "--verbose");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Starting worker with ID: cli_noop").contains("Max cycles: 2");

        StatusSnapshot status = new FileStatusStore(dir.resolve("stats")).read("cli_noop").orElseThrow();
        assertThat(status.totalWorkCycles()).isEqualTo(2);
        assertThat(status.status()).isEqualTo(WorkerPhase.STOPPED);
        assertThat(dir.resolve("logs").resolve("cli_noop.log")).exists();
    }

    @Test
    void workerProcessesLogWithoutTheSharedLogFile() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        FileAppender<ILoggingEvent> shared = new FileAppender<>();
        shared.setName("FILE");
        shared.setContext(context);
        shared.setFile(dir.resolve("mini-worker.log").toString());
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%msg%n");
        encoder.start();
        shared.setEncoder(encoder);
        shared.start();
        root.addAppender(shared);

        int exit = cli.execute("run",
                "--worker-class", TestWorkers.NoopWorker.class.getName(),
                "--log-dir", dir.resolve("logs").toString(),
                "--wait-seconds", "0",
                "--max-cycles", "1");

        assertThat(exit).isZero();
        List<Appender<ILoggingEvent>> appenders = new ArrayList<>();
        root.iteratorForAppenders().forEachRemaining(appenders::add);
        assertThat(appenders).isNotEmpty().noneMatch(appender -> appender instanceof FileAppender);
        assertThat(appenders).anyMatch(appender -> appender instanceof ConsoleAppender);
        assertThat(dir.resolve("logs").resolve("noop_worker.log")).exists();
    }

    @Test
    void statsDirDefaultsToTheLogDir() {
        int exit = cli.execute("run",
                "--worker-class", TestWorkers.NoopWorker.class.getName(),
                "--log-dir", dir.toString(),
                "--wait-seconds", "0",
                "--max-cycles", "1");

        assertThat(exit).isZero();
        assertThat(dir.resolve("noop_worker.json")).exists();
        assertThat(dir.resolve("noop_worker.stats")).exists();
        assertThat(dir.resolve("noop_worker.pid")).doesNotExist();
    }

    @Test
    void invalidParametersExitWithOne() {
        int exit = cli.execute("run",
                "--worker-class", TestWorkers.NoopWorker.class.getName(),
                "--worker-params", "{not json");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Invalid JSON in worker params");
    }

    @Test
    void unloadableWorkerClassExitsWithOne() {
        int exit = cli.execute("run", "--worker-class", "com.example.Missing");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString())
                .contains("Error importing worker class 'com.example.Missing'")
                .contains("public no-argument constructor");
    }

    @Test
    void workerClassIsRequired() {
        int exit = cli.execute("run");

        assertThat(exit).isEqualTo(2);
        assertThat(err.toString()).contains("--worker-class");
    }

    @Test
    void parsesParameterObjects() {
        Map<String, Object> params = RunCommand.parseParams("{\"a\": 1, \"b\": [\"x\", \"y\"], \"c\": {\"d\": true}}");

        assertThat(params).containsEntry("a", 1).containsEntry("b", List.of("x", "y"));
        assertThat(params.get("c")).isEqualTo(Map.of("d", true));
        assertThat(RunCommand.parseParams("  ")).isEmpty();
        assertThatThrownBy(() -> RunCommand.parseParams("[1, 2]")).isInstanceOf(IllegalArgumentException.class);
    }
}
