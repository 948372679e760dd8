package org.miniworker.manager;

import org.miniworker.monitoring.StatusStore;

import java.util.Optional;

/**
 * Decides whether a worker is alive: its pid marker must exist and the recorded pid
 * must be in the live process table. A marker left behind by a crashed worker
 * therefore reads as not running.
 */
public class LivenessProbe {
    private final StatusStore statusStore;
    private final ProcessTable processTable;

    public LivenessProbe(StatusStore statusStore, ProcessTable processTable) {
        this.statusStore = statusStore;
        this.processTable = processTable;
    }

    /**
     * Pid of the live worker, empty when no marker exists or the pid is gone.
     */
    public Optional<Long> livePid(String workerId) {
        return statusStore.readLivenessMarker(workerId).filter(processTable::isAlive);
    }

    public boolean isAlive(String workerId) {
        return livePid(workerId).isPresent();
    }

    /**
     * True when a marker exists but its process does not.
     */
    public boolean hasStaleMarker(String workerId) {
        return statusStore.readLivenessMarker(workerId)
                .map(pid -> !processTable.isAlive(pid))
                .orElse(false);
    }
}
