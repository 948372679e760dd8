package org.miniworker.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle phase published in every status snapshot.
 * INITIALIZING -> RUNNING -> (WAITING <-> RUNNING)* -> STOPPED; STOPPED is terminal.
 */
public enum WorkerPhase {
    INITIALIZING,
    RUNNING,
    WAITING,
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkerPhase fromWireName(String value) {
        return WorkerPhase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
