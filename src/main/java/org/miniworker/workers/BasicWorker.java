package org.miniworker.workers;

import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerContext;
import org.slf4j.Logger;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulates processing a few items per cycle.
 * <p>
 * Params: {@code message}, {@code min_delay} and {@code max_delay} (seconds per item).
 */
public class BasicWorker implements Worker {

    private String message = "Hello from BasicWorker!";
    private double minDelay = 1;
    private double maxDelay = 5;

    @Override
    public String workerId() {
        return "basic_worker";
    }

    @Override
    public void setup(WorkerContext context) {
        message = context.stringParam("message", message);
        minDelay = context.doubleParam("min_delay", minDelay);
        maxDelay = Math.max(minDelay, context.doubleParam("max_delay", maxDelay));

        Logger log = context.logger();
        log.info("BasicWorker setup complete");
        log.info("Message: {}", message);
        log.info("Delay range: {}-{} seconds", minDelay, maxDelay);
    }

    @Override
    public void doWork(WorkerContext context) throws Exception {
        Logger log = context.logger();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        context.trackOperation("process_items", () -> {
            int items = random.nextInt(1, 6);
            for (int i = 1; i <= items; i++) {
                log.info("Processing item {}/{}", i, items);
                double delay = randomDelay(minDelay, maxDelay);
                sleepSeconds(delay);
                log.info("Completed item {} in {}s", i, String.format(Locale.ROOT, "%.2f", delay));
            }
        });

        context.trackOperation("cleanup_tasks", () -> {
            log.info("Performing cleanup...");
            sleepSeconds(randomDelay(Math.min(0.5, maxDelay), Math.min(2.0, maxDelay)));
            log.info("Cleanup completed");
        });

        log.info("Work cycle completed. Message: {}", message);
    }

    @Override
    public void cleanup(WorkerContext context) {
        context.logger().info("BasicWorker cleanup completed");
    }

    private static double randomDelay(double min, double max) {
        return max > min ? ThreadLocalRandom.current().nextDouble(min, max) : min;
    }

    static void sleepSeconds(double seconds) throws InterruptedException {
        if (seconds > 0) {
            Thread.sleep((long) (seconds * 1000));
        }
    }
}
