package org.miniworker.workers;

import org.junit.jupiter.api.Test;
import org.miniworker.testing.WorkerContexts;
import org.miniworker.tracking.OperationTracker;
import org.miniworker.worker.WorkerContext;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatchWorkerTest {

    private final OperationTracker tracker = new OperationTracker(() -> { });

    private BatchWorker setUp(Map<String, Object> params) {
        BatchWorker worker = new BatchWorker();
        worker.setup(WorkerContexts.of("batch_worker", params, tracker));
        return worker;
    }

    @Test
    void drainsTheBacklogInBatches() throws Exception {
        BatchWorker worker = setUp(Map.of("batch_size", 4, "total_items", 10,
                "processing_delay", 0, "error_rate", 0.0, "seed", 1));
        WorkerContext context = WorkerContexts.of("batch_worker", Map.of(), tracker);

        worker.doWork(context);
        assertThat(worker.processedCount()).isEqualTo(4);
        assertThat(worker.pendingCount()).isEqualTo(6);

        worker.doWork(context);
        worker.doWork(context);
        assertThat(worker.processedCount()).isEqualTo(10);
        assertThat(worker.pendingCount()).isZero();

        // nothing left: no batch is tracked
        worker.doWork(context);
        assertThat(tracker.stats("process_batch").count()).isEqualTo(3);
        assertThat(tracker.stats("update_stats").count()).isEqualTo(3);
    }

    @Test
    void failedItemsAreDroppedNotRetried() throws Exception {
        BatchWorker worker = setUp(Map.of("batch_size", 5, "total_items", 5,
                "processing_delay", 0, "error_rate", 1.0));

        worker.doWork(WorkerContexts.of("batch_worker", Map.of(), tracker));

        assertThat(worker.processedCount()).isZero();
        assertThat(worker.pendingCount()).isZero();
        assertThat(tracker.stats("process_batch").count()).isEqualTo(1);
    }
}
