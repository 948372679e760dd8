package org.miniworker.worker;

import org.miniworker.config.utils.LogContext;
import org.miniworker.monitoring.FileStatusStore;
import org.miniworker.monitoring.StatusSnapshot;
import org.miniworker.monitoring.StatusStore;
import org.miniworker.tracking.OperationTracker;
import org.miniworker.utils.SystemInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one {@link Worker} through its lifecycle:
 * setup, timed work cycles, teardown, with the status published at every cycle
 * boundary and after every tracked operation.
 * <p>
 * The loop runs on the calling thread. Cancellation is cooperative: a stop request
 * (JVM shutdown hook or {@link #requestShutdown()}) is seen at the top of each cycle
 * and between the at most one second long sleeps of the inter-cycle wait. Work in
 * flight is never interrupted.
 * <p>
 * Whatever ends the run, the loop publishes a final {@code stopped} snapshot, calls
 * cleanup once and removes the pid marker.
 */
public class WorkerLoop {
    private static final Logger logger = LoggerFactory.getLogger(WorkerLoop.class);

    private static final long MAX_SLEEP_STEP_MILLIS = 1000L;
    private static final Duration SHUTDOWN_HOOK_TIMEOUT = Duration.ofSeconds(30);

    private final Worker worker;
    private final WorkerConfig config;
    private final String workerId;
    private final StatusStore statusStore;
    private final Clock clock;
    private final CycleStats stats = new CycleStats();
    private final OperationTracker tracker;
    private final Object statusLock = new Object();
    private final Object publishLock = new Object();

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile Logger log = logger;

    public WorkerLoop(Worker worker, WorkerConfig config) {
        this(worker, config, new FileStatusStore(config.statsDir()), Clock.systemUTC());
    }

    public WorkerLoop(Worker worker, WorkerConfig config, StatusStore statusStore, Clock clock) {
        this.worker = worker;
        this.config = config;
        this.workerId = resolveWorkerId(worker, config);
        this.statusStore = statusStore;
        this.clock = clock;
        this.tracker = new OperationTracker(clock, this::publishStatus);
    }

    private static String resolveWorkerId(Worker worker, WorkerConfig config) {
        if (config.workerId() != null && !config.workerId().isBlank()) {
            return config.workerId();
        }
        String id = worker.workerId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(worker.getClass().getName() + " returned no worker id");
        }
        return id;
    }

    /**
     * Runs the worker until the cycle bound is reached, a stop is requested, or an
     * unrecoverable error occurs. May be called once per instance.
     */
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker loop for " + workerId + " has already been run");
        }

        LogContext.forWorker("WorkerLoop", workerId);
        WorkerLogging logging = null;
        WorkerContext context = null;
        Thread hook = null;
        try {
            Files.createDirectories(config.logDir());
            logging = WorkerLogging.open(workerId, config.logDir());
            log = logging.logger();
            tracker.useLogger(log);
            context = newContext();

            if (config.installShutdownHook()) {
                hook = installShutdownHook();
            }
            statusStore.writeLivenessMarker(workerId, SystemInfo.currentPid());

            log.info("Starting {} worker", worker.getClass().getSimpleName());
            log.info("Worker ID: {}", workerId);
            log.info("Wait time: {} seconds", config.waitInterval().toSeconds());
            log.info("Max cycles: {}", config.maxCycles() != null ? config.maxCycles() : "unlimited");

            transition(WorkerPhase.RUNNING);
            runSetup(context);
            runCycles(context);
        } catch (IOException e) {
            log.error("Cannot prepare log directory {}: {}", config.logDir(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in worker: {}", e.getMessage(), e);
        } finally {
            transition(WorkerPhase.STOPPED);
            publishStatus();
            runCleanup(context != null ? context : newContext());
            statusStore.removeLivenessMarker(workerId);
            log.info("Worker {} stopped", workerId);

            removeShutdownHook(hook);
            if (logging != null) {
                logging.close();
            }
            log = logger;
            LogContext.clear();
            finished.countDown();
        }
    }

    private void runSetup(WorkerContext context) {
        log.info("Worker setup started");
        try {
            worker.setup(context);
            log.info("Worker setup completed");
        } catch (Exception e) {
            // setup failures are not fatal, cycles still run
            log.error("Worker setup failed: {}", e.getMessage(), e);
        }
    }

    private void runCleanup(WorkerContext context) {
        log.info("Worker cleanup started");
        try {
            worker.cleanup(context);
            log.info("Worker cleanup completed");
        } catch (Exception e) {
            log.error("Worker cleanup failed: {}", e.getMessage(), e);
        }
    }

    private void runCycles(WorkerContext context) {
        long completed = 0;
        while (!shutdownRequested.get() && !reachedMaxCycles(completed)) {
            long cycle = completed + 1;
            transition(WorkerPhase.RUNNING);

            double start = nowSeconds();
            try {
                log.info("Starting work cycle {}", cycle);
                worker.doWork(context);
                log.info("Work cycle completed successfully");
            } catch (Exception e) {
                WorkCycleException failure = new WorkCycleException(cycle, e);
                log.error(failure.getMessage(), failure);
            }
            double end = nowSeconds();

            synchronized (statusLock) {
                stats.recordCycle(start, end);
                stats.transitionTo(WorkerPhase.WAITING);
            }
            publishStatus();
            completed++;

            if (!reachedMaxCycles(completed)) {
                waitBeforeNextCycle(end - start);
            }
        }

        if (reachedMaxCycles(completed)) {
            log.info("Reached max cycles limit ({})", config.maxCycles());
        } else if (shutdownRequested.get()) {
            log.info("Shutdown requested after {} cycles", completed);
        }
    }

    private boolean reachedMaxCycles(long completed) {
        return config.maxCycles() != null && completed >= config.maxCycles();
    }

    /**
     * Sleeps for the wait interval minus the time the cycle already took, in steps of
     * at most one second so that a stop request is honored promptly.
     */
    private void waitBeforeNextCycle(double elapsedSeconds) {
        if (shutdownRequested.get() || config.waitInterval().isZero()) {
            return;
        }
        long sleepMillis = Math.max(0L, config.waitInterval().toMillis() - (long) (elapsedSeconds * 1000));
        log.info("Waiting {} seconds before next cycle", String.format(Locale.ROOT, "%.1f", sleepMillis / 1000.0));

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(sleepMillis);
        while (!shutdownRequested.get()) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(MAX_SLEEP_STEP_MILLIS, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Interrupted while waiting. Requesting shutdown...");
                shutdownRequested.set(true);
            }
        }
    }

    /**
     * Asks the loop to stop at its next checkpoint. Safe to call from any thread.
     */
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Shutdown requested for worker {}", workerId);
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * Waits for a started run to finish its teardown.
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private Thread installShutdownHook() {
        Thread hook = new Thread(() -> {
            log.info("Received termination signal. Requesting shutdown...");
            requestShutdown();
            try {
                if (!finished.await(SHUTDOWN_HOOK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker {} did not stop within {}s", workerId, SHUTDOWN_HOOK_TIMEOUT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "mini-worker-shutdown-" + workerId);
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private void removeShutdownHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM shutdown in progress, leaving hook for {} in place", workerId);
        }
    }

    private WorkerContext newContext() {
        return new WorkerContext(workerId, log, config, tracker, shutdownRequested::get);
    }

    private void transition(WorkerPhase next) {
        synchronized (statusLock) {
            stats.transitionTo(next);
        }
    }

    /**
     * Writes a fresh snapshot to the status store. Never throws.
     */
    void publishStatus() {
        synchronized (publishLock) {
            statusStore.write(workerId, snapshot());
        }
    }

    /**
     * Builds the current status; never cached.
     */
    public StatusSnapshot snapshot() {
        synchronized (statusLock) {
            return new StatusSnapshot(
                    workerId,
                    stats.phase(),
                    stats.totalWorkCycles(),
                    stats.totalProcessingTime(),
                    stats.lastWorkCycleTime(),
                    stats.lastWorkCycleStart(),
                    stats.lastWorkCycleEnd(),
                    stats.startTime(),
                    tracker.snapshot(),
                    nowSeconds());
        }
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    public String workerId() {
        return workerId;
    }

    public WorkerPhase phase() {
        return stats.phase();
    }

    public OperationTracker tracker() {
        return tracker;
    }

    public WorkerConfig config() {
        return config;
    }
}
