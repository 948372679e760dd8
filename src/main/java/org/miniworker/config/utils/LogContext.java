package org.miniworker.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Centralized MDC context management for consistent logging.
 * Adds "component" and "worker.id" (or a generated "trace.id") to every log entry.
 */
public class LogContext {
    public static final String COMPONENT = "component";
    public static final String WORKER_ID = "worker.id";
    public static final String TRACE_ID = "trace.id";

    private LogContext() {};

    public static void start(String component) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, UUID.randomUUID().toString());
    }

    public static void forWorker(String component, String workerId) {
        MDC.put(COMPONENT, component);
        MDC.put(WORKER_ID, workerId);
    }

    public static void clear() {
        MDC.clear();
    }
}



/**
 *| Action                              | Rule                                          |
 * | ----------------------------------- | --------------------------------------------- |
 * | At start of a worker loop run       | `LogContext.forWorker("WorkerLoop", id)`      |
 * | At start of a CLI / server command  | `LogContext.start("ComponentName")`           |
 * | At end (in finally block)           | `LogContext.clear()`                          |
 * | Threads spawned by a worker         | Call `LogContext.forWorker()` inside runnables |
 * */
