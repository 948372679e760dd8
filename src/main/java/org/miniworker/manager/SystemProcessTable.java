package org.miniworker.manager;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link ProcessTable} backed by {@link ProcessHandle}.
 */
public class SystemProcessTable implements ProcessTable {
    private static final Logger logger = LoggerFactory.getLogger(SystemProcessTable.class);

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public Optional<ProcessInfo> find(long pid) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(SystemProcessTable::toInfo);
    }

    @Override
    public List<ProcessInfo> snapshot() {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .map(SystemProcessTable::toInfo)
                .collect(Collectors.toList());
    }

    @Override
    public boolean requestTermination(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroy).orElse(false);
    }

    @Override
    public boolean awaitExit(long pid, Duration timeout) throws InterruptedException {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return true;
        }
        try {
            handle.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !handle.get().isAlive();
        } catch (ExecutionException e) {
            logger.warn("Failed waiting for process {} to exit: {}", pid, e.getMessage());
            return !handle.get().isAlive();
        }
    }

    @Override
    public boolean forceKill(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroyForcibly).orElse(false);
    }

    @NotNull
    private static ProcessInfo toInfo(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        String commandLine = info.commandLine().orElseGet(() -> info.command().orElse(""));
        return new ProcessInfo(handle.pid(), commandLine, info.startInstant().orElse(null));
    }
}
