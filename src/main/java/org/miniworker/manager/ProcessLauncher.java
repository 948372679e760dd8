package org.miniworker.manager;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Spawns a worker process from a full command line and extra environment variables.
 */
@FunctionalInterface
public interface ProcessLauncher {

    Process launch(List<String> command, Map<String, String> environment) throws IOException;

    /**
     * Launcher that detaches the child from the caller: standard streams are
     * discarded (the worker writes its own log file) and, where {@code setsid} is
     * available, the child runs in a session of its own so that a hangup or Ctrl-C
     * aimed at the caller's terminal does not reach it.
     */
    static ProcessLauncher detached() {
        Optional<Path> setsid = sessionLauncher();
        return (command, environment) -> {
            List<String> full = new ArrayList<>();
            setsid.ifPresent(path -> full.add(path.toString()));
            full.addAll(command);
            ProcessBuilder builder = new ProcessBuilder(full)
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD);
            builder.environment().putAll(environment);
            return builder.start();
        };
    }

    /**
     * The {@code setsid} binary, if this is a system that has one.
     */
    static Optional<Path> sessionLauncher() {
        if (isWindows()) {
            return Optional.empty();
        }
        return Optional.of(Path.of("/usr/bin/setsid"))
                .filter(Files::isExecutable)
                .or(() -> Optional.of(Path.of("/bin/setsid")).filter(Files::isExecutable));
    }

    private static File nullDevice() {
        return new File(isWindows() ? "NUL" : "/dev/null");
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
