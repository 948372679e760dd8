package org.miniworker.workers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.miniworker.testing.WorkerContexts;
import org.miniworker.tracking.OperationTracker;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiskUsageWorkerTest {

    @TempDir
    Path dir;

    private final OperationTracker tracker = new OperationTracker(() -> { });
    private final DiskUsageWorker worker = new DiskUsageWorker();

    @Test
    void recordsFreeSpaceOfThePath() throws Exception {
        worker.doWork(WorkerContexts.of("disk", Map.of("path", dir.toString(), "min_free_percent", 0), tracker));

        assertThat(worker.lastFreePercent()).isBetween(0.0, 100.0);
        assertThat(tracker.stats("check_disk").count()).isEqualTo(1);
    }

    @Test
    void missingPathFailsTheCheck() {
        String missing = dir.resolve("gone").toString();

        assertThatThrownBy(() -> worker.doWork(WorkerContexts.of("disk", Map.of("path", missing), tracker)))
                .isInstanceOf(NoSuchFileException.class);
        assertThat(tracker.stats("check_disk").count()).isZero();
    }
}
