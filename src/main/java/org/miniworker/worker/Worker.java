package org.miniworker.worker;

/**
 * A unit of periodic work run by {@link WorkerLoop}.
 * <p>
 * Implementations need a public no-argument constructor so that they can be
 * created from a class name on the command line. Operator parameters, the log
 * sink and operation tracking are reached through the {@link WorkerContext}
 * handed to every callback.
 * <p>
 * {@link #setup} and {@link #cleanup} are hooks: the loop always performs its own
 * setup/cleanup step around them, so an override only adds behaviour.
 */
public interface Worker {

    /**
     * Default identifier for this worker type, used when no id is supplied.
     * Must not depend on any state set up later.
     */
    String workerId();

    /**
     * One work cycle. Exceptions are logged by the loop and do not stop it.
     */
    void doWork(WorkerContext context) throws Exception;

    default void setup(WorkerContext context) throws Exception {
    }

    default void cleanup(WorkerContext context) throws Exception {
    }
}
