package org.miniworker.workers;

import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerContext;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Drains an in-memory backlog in batches.
 * <p>
 * Params: {@code batch_size} (10), {@code total_items} (100), {@code processing_delay}
 * seconds per item (0.1), {@code error_rate} (0.05) and an optional {@code seed}.
 */
public class BatchWorker implements Worker {

    private final Deque<Integer> pending = new ArrayDeque<>();
    private final List<Integer> processed = new ArrayList<>();
    private int batchSize = 10;
    private double processingDelay = 0.1;
    private double errorRate = 0.05;
    private Random random = new Random();

    @Override
    public String workerId() {
        return "batch_worker";
    }

    @Override
    public void setup(WorkerContext context) {
        batchSize = Math.max(1, context.intParam("batch_size", batchSize));
        processingDelay = context.doubleParam("processing_delay", processingDelay);
        errorRate = context.doubleParam("error_rate", errorRate);
        if (context.params().containsKey("seed")) {
            random = new Random(context.longParam("seed", 0));
        }
        int totalItems = context.intParam("total_items", 100);
        for (int i = 1; i <= totalItems; i++) {
            pending.add(i);
        }

        Logger log = context.logger();
        log.info("BatchWorker setup complete");
        log.info("Batch size: {}", batchSize);
        log.info("Processing delay: {}s per item", processingDelay);
        log.info("Total items to process: {}", pending.size());
    }

    @Override
    public void doWork(WorkerContext context) throws Exception {
        Logger log = context.logger();
        List<Integer> batch = nextBatch();
        if (batch.isEmpty()) {
            log.info("No more items to process");
            return;
        }

        log.info("Processing batch of {} items", batch.size());
        context.trackOperation("process_batch", () -> processBatch(batch, log));
        context.trackOperation("update_stats", () -> logProgress(log));
        log.info("Batch completed. Remaining items: {}", pending.size());
    }

    private List<Integer> nextBatch() {
        List<Integer> batch = new ArrayList<>();
        while (batch.size() < batchSize && !pending.isEmpty()) {
            batch.add(pending.poll());
        }
        return batch;
    }

    private void processBatch(List<Integer> batch, Logger log) throws InterruptedException {
        int succeeded = 0;
        for (Integer item : batch) {
            log.debug("Processing item {}", item);
            BasicWorker.sleepSeconds(processingDelay);
            if (random.nextDouble() < errorRate) {
                log.warn("Failed to process item {}", item);
                continue;
            }
            processed.add(item);
            succeeded++;
        }
        log.info("Successfully processed {} items", succeeded);
    }

    private void logProgress(Logger log) {
        int total = processed.size() + pending.size();
        double completion = total == 0 ? 100.0 : processed.size() * 100.0 / total;
        log.info("Progress: {}/{} ({}%)", processed.size(), total, String.format(Locale.ROOT, "%.1f", completion));
    }

    @Override
    public void cleanup(WorkerContext context) {
        context.logger().info("BatchWorker cleanup - Processed {} items total", processed.size());
    }

    int processedCount() {
        return processed.size();
    }

    int pendingCount() {
        return pending.size();
    }
}
