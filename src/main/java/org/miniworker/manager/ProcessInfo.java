package org.miniworker.manager;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * One entry of the operating system process table.
 *
 * @param startTime when the process started, {@code null} if the OS does not say
 */
public record ProcessInfo(long pid, String commandLine, Instant startTime) {

    public ProcessInfo {
        commandLine = commandLine == null ? "" : commandLine;
    }

    /**
     * Command line split on whitespace.
     */
    public List<String> arguments() {
        if (commandLine.isBlank()) {
            return List.of();
        }
        return Arrays.asList(commandLine.trim().split("\\s+"));
    }

    /**
     * Start time as epoch seconds, the unit used by status snapshots.
     */
    public Double startEpochSeconds() {
        return startTime == null ? null : startTime.toEpochMilli() / 1000.0;
    }
}
