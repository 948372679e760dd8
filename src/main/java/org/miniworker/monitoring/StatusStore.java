package org.miniworker.monitoring;

import java.util.List;
import java.util.Optional;

/**
 * Where workers publish their status and liveness marker, and where managers and
 * tooling read them back. Implementations never throw to the caller: a monitoring
 * failure must not take a worker down.
 */
public interface StatusStore {

    /**
     * Persist the latest snapshot of {@code workerId}, replacing the previous one.
     */
    void write(String workerId, StatusSnapshot snapshot);

    /**
     * Last snapshot written, or empty when none exists or it cannot be read.
     */
    Optional<StatusSnapshot> read(String workerId);

    void writeLivenessMarker(String workerId, long pid);

    void removeLivenessMarker(String workerId);

    /**
     * Pid recorded for {@code workerId}. A present value says nothing about whether
     * that process is still alive.
     */
    Optional<Long> readLivenessMarker(String workerId);

    /**
     * Ids of every worker with a snapshot on record, sorted.
     */
    List<String> knownWorkerIds();
}
