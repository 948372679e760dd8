package org.miniworker.manager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * View of, and control over, the operating system's live processes.
 */
public interface ProcessTable {

    boolean isAlive(long pid);

    Optional<ProcessInfo> find(long pid);

    /**
     * Every process visible to the current user. Processes may exit while or after
     * the list is built.
     */
    List<ProcessInfo> snapshot();

    /**
     * Sends a graceful termination request (SIGTERM on POSIX).
     *
     * @return false if the process is gone or the request was refused
     */
    boolean requestTermination(long pid);

    /**
     * Blocks until the process exits or {@code timeout} elapses.
     *
     * @return true if the process is gone
     */
    boolean awaitExit(long pid, Duration timeout) throws InterruptedException;

    /**
     * Kills the process without giving it a chance to clean up (SIGKILL on POSIX).
     */
    boolean forceKill(long pid);
}
