package org.miniworker.manager;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Where managed workers write their files and how they are launched.
 *
 * @param javaExecutable java binary used to spawn workers
 * @param classpath      class path handed to spawned workers, must contain the worker classes
 * @param stopGrace      time a worker gets to exit after a termination request before it is killed
 */
public record ManagerSettings(
        Path logDir,
        Path statsDir,
        String javaExecutable,
        String classpath,
        Duration stopGrace
) {

    public static final Duration DEFAULT_STOP_GRACE = Duration.ofSeconds(5);

    public ManagerSettings {
        Objects.requireNonNull(logDir, "logDir");
        Objects.requireNonNull(statsDir, "statsDir");
        javaExecutable = javaExecutable == null || javaExecutable.isBlank() ? currentJava() : javaExecutable;
        classpath = classpath == null || classpath.isBlank() ? System.getProperty("java.class.path") : classpath;
        stopGrace = stopGrace == null ? DEFAULT_STOP_GRACE : stopGrace;
    }

    /**
     * Settings that launch workers with the running JVM and its class path.
     */
    public static ManagerSettings of(Path logDir, Path statsDir) {
        return new ManagerSettings(logDir, statsDir, null, null, null);
    }

    static String currentJava() {
        return ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    }
}
