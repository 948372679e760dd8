package org.miniworker.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.miniworker.monitoring.FileStatusStore;
import org.miniworker.monitoring.StatusSnapshot;
import org.miniworker.testing.RecordingStatusStore;
import org.miniworker.utils.SystemInfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WorkerLoopTest {

    @TempDir
    Path dir;

    private FileStatusStore fileStore;
    private RecordingStatusStore store;

    @BeforeEach
    void setUp() {
        fileStore = new FileStatusStore(dir.resolve("stats"));
        store = new RecordingStatusStore(fileStore);
    }

    private WorkerConfig.Builder config() {
        return WorkerConfig.builder()
                .logDir(dir.resolve("logs"))
                .statsDir(dir.resolve("stats"))
                .waitSeconds(0)
                .installShutdownHook(false);
    }

    private WorkerLoop loop(Worker worker, WorkerConfig config) {
        return new WorkerLoop(worker, config, store, Clock.systemUTC());
    }

    @Test
    void runsExactlyMaxCyclesAndReportsThem() {
        CountingWorker worker = new CountingWorker();
        WorkerLoop loop = loop(worker, config().maxCycles(3).build());

        loop.run();

        assertThat(worker.cycles).hasValue(3);
        assertThat(loop.phase()).isEqualTo(WorkerPhase.STOPPED);

        StatusSnapshot persisted = fileStore.read("counting_worker").orElseThrow();
        assertThat(persisted.totalWorkCycles()).isEqualTo(3);
        assertThat(persisted.status()).isEqualTo(WorkerPhase.STOPPED);
        assertThat(persisted.startTime()).isNotNull();
        assertThat(Files.exists(fileStore.statsFile("counting_worker"))).isTrue();
    }

    @Test
    void zeroMaxCyclesRunsNoCyclesButStillSetsUpAndCleansUp() {
        CountingWorker worker = new CountingWorker();

        loop(worker, config().maxCycles(0).build()).run();

        assertThat(worker.cycles).hasValue(0);
        assertThat(worker.setups).hasValue(1);
        assertThat(worker.cleanups).hasValue(1);
        StatusSnapshot last = store.last();
        assertThat(last.totalWorkCycles()).isZero();
        assertThat(last.startTime()).isNull();
        assertThat(last.status()).isEqualTo(WorkerPhase.STOPPED);
    }

    @Test
    void setupFailureIsNotFatalAndCleanupRunsOnce() {
        CountingWorker worker = new CountingWorker();
        worker.failSetup = true;

        loop(worker, config().maxCycles(2).build()).run();

        assertThat(worker.cycles).hasValue(2);
        assertThat(worker.cleanups).hasValue(1);
    }

    @Test
    void doWorkErrorsAreContainedAndStillCountAsCycles() throws IOException {
        CountingWorker worker = new CountingWorker();
        worker.failEveryCycle = true;
        WorkerLoop loop = loop(worker, config().maxCycles(3).build());

        loop.run();

        assertThat(worker.cycles).hasValue(3);
        assertThat(store.last().totalWorkCycles()).isEqualTo(3);
        String log = Files.readString(dir.resolve("logs").resolve("counting_worker.log"));
        assertThat(log)
                .contains("Error in work cycle 1: cycle failed")
                .contains("Error in work cycle 3: cycle failed")
                .contains("Reached max cycles limit (3)");
    }

    @Test
    void cancellationDuringLongWaitIsHonoredWithinASecond() throws Exception {
        CountDownLatch firstCycleDone = new CountDownLatch(1);
        CountingWorker worker = new CountingWorker();
        worker.afterCycle = firstCycleDone::countDown;
        WorkerLoop loop = loop(worker, config().waitSeconds(60).build());

        Thread runner = new Thread(loop::run, "loop-under-test");
        runner.start();
        assertThat(firstCycleDone.await(5, TimeUnit.SECONDS)).isTrue();
        // let the loop enter its wait
        Thread.sleep(200);

        long requestedAt = System.nanoTime();
        loop.requestShutdown();
        assertThat(loop.awaitStopped(Duration.ofSeconds(3))).isTrue();
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - requestedAt);

        runner.join(1000);
        assertThat(tookMillis).isLessThan(1500);
        assertThat(worker.cycles).hasValue(1);
        assertThat(worker.cleanups).hasValue(1);
        assertThat(store.last().status()).isEqualTo(WorkerPhase.STOPPED);
    }

    @Test
    void interruptDuringWaitStopsTheLoop() throws Exception {
        CountDownLatch firstCycleDone = new CountDownLatch(1);
        CountingWorker worker = new CountingWorker();
        worker.afterCycle = firstCycleDone::countDown;
        WorkerLoop loop = loop(worker, config().waitSeconds(60).build());

        Thread runner = new Thread(loop::run, "loop-under-test");
        runner.start();
        assertThat(firstCycleDone.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        runner.interrupt();

        assertThat(loop.awaitStopped(Duration.ofSeconds(3))).isTrue();
        assertThat(loop.isShutdownRequested()).isTrue();
        assertThat(worker.cleanups).hasValue(1);
    }

    @Test
    void livenessMarkerExistsWhileRunningAndIsRemovedAfterwards() {
        AtomicReference<String> pidDuringRun = new AtomicReference<>();
        CountingWorker worker = new CountingWorker();
        worker.afterCycle = () -> {
            try {
                pidDuringRun.set(Files.readString(fileStore.pidFile("counting_worker")).trim());
            } catch (IOException e) {
                pidDuringRun.set("missing");
            }
        };

        loop(worker, config().maxCycles(1).build()).run();

        assertThat(pidDuringRun.get()).isEqualTo(Long.toString(SystemInfo.currentPid()));
        assertThat(Files.exists(fileStore.pidFile("counting_worker"))).isFalse();
        assertThat(store.markersWritten()).containsExactly(SystemInfo.currentPid());
    }

    @Test
    void publishedSnapshotsNeverGoBackInCycleCount() {
        CountingWorker worker = new CountingWorker();
        worker.trackEachCycle = true;

        loop(worker, config().maxCycles(5).build()).run();

        List<Long> cycleCounts = new ArrayList<>();
        for (StatusSnapshot s : store.written()) {
            cycleCounts.add(s.totalWorkCycles());
        }
        assertThat(cycleCounts).isSorted();
        assertThat(cycleCounts.get(cycleCounts.size() - 1)).isEqualTo(5);
    }

    @Test
    void everyCompletedOperationPublishesAFullSnapshot() {
        CountingWorker worker = new CountingWorker();
        worker.trackEachCycle = true;

        loop(worker, config().maxCycles(2).build()).run();

        // per cycle: one publish from the operation, one at the cycle boundary; plus the final one
        assertThat(store.written()).hasSize(5);
        StatusSnapshot afterFirstOperation = store.written().get(0);
        assertThat(afterFirstOperation.status()).isEqualTo(WorkerPhase.RUNNING);
        assertThat(afterFirstOperation.totalWorkCycles()).isZero();
        assertThat(afterFirstOperation.operation("step").count()).isEqualTo(1);
        assertThat(store.last().operation("step").count()).isEqualTo(2);
    }

    @Test
    void failedOperationIsExcludedButTheCycleGoesOn() {
        AtomicInteger reachedEnd = new AtomicInteger();
        Worker worker = new Worker() {
            @Override
            public String workerId() {
                return "flaky";
            }

            @Override
            public void doWork(WorkerContext context) throws Exception {
                try {
                    context.trackOperation("x", () -> {
                        Thread.sleep(100);
                        throw new IOException("first attempt fails");
                    });
                } catch (IOException expected) {
                    context.logger().info("retrying");
                }
                context.trackOperation("x", () -> {
                    Thread.sleep(100);
                });
                reachedEnd.incrementAndGet();
            }
        };

        loop(worker, config().maxCycles(1).build()).run();

        assertThat(reachedEnd).hasValue(1);
        StatusSnapshot last = store.last();
        assertThat(last.operation("x").count()).isEqualTo(1);
        assertThat(last.operation("x").totalDuration()).isCloseTo(0.1, within(0.08));
    }

    @Test
    void phasesMoveFromRunningThroughWaitingToStopped() {
        CountingWorker worker = new CountingWorker();
        List<WorkerPhase> seenInCycle = new ArrayList<>();
        WorkerLoop loop = loop(worker, config().maxCycles(2).build());
        worker.afterCycle = () -> seenInCycle.add(loop.phase());

        loop.run();

        assertThat(seenInCycle).containsOnly(WorkerPhase.RUNNING);
        assertThat(store.written())
                .extracting(StatusSnapshot::status)
                .containsSubsequence(WorkerPhase.WAITING, WorkerPhase.WAITING, WorkerPhase.STOPPED);
    }

    @Test
    void aLoopCanOnlyRunOnce() {
        WorkerLoop loop = loop(new CountingWorker(), config().maxCycles(1).build());
        loop.run();

        assertThatThrownBy(loop::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void configuredIdOverridesTheWorkerDefault() {
        WorkerLoop loop = loop(new CountingWorker(), config().workerId("custom_id").maxCycles(1).build());

        loop.run();

        assertThat(loop.workerId()).isEqualTo("custom_id");
        assertThat(fileStore.read("custom_id")).isPresent();
        assertThat(fileStore.read("counting_worker")).isEmpty();
    }

    @Test
    void workerWithoutIdIsRejected() {
        Worker anonymous = new Worker() {
            @Override
            public String workerId() {
                return " ";
            }

            @Override
            public void doWork(WorkerContext context) {
            }
        };

        assertThatThrownBy(() -> loop(anonymous, config().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parametersReachTheWorker() {
        AtomicReference<String> seen = new AtomicReference<>();
        Worker worker = new Worker() {
            @Override
            public String workerId() {
                return "params";
            }

            @Override
            public void doWork(WorkerContext context) {
                seen.set(context.stringParam("greeting", "none") + "/" + context.intParam("count", -1));
            }
        };

        loop(worker, config().maxCycles(1).params(Map.of("greeting", "hi", "count", 3)).build()).run();

        assertThat(seen.get()).isEqualTo("hi/3");
    }

    /**
     * Counts its callbacks; behaviour switched by flags.
     */
    static class CountingWorker implements Worker {
        final AtomicInteger setups = new AtomicInteger();
        final AtomicInteger cycles = new AtomicInteger();
        final AtomicInteger cleanups = new AtomicInteger();
        volatile boolean failSetup;
        volatile boolean failEveryCycle;
        volatile boolean trackEachCycle;
        volatile Runnable afterCycle = () -> { };

        @Override
        public String workerId() {
            return "counting_worker";
        }

        @Override
        public void setup(WorkerContext context) {
            setups.incrementAndGet();
            if (failSetup) {
                throw new IllegalStateException("setup failed");
            }
        }

        @Override
        public void doWork(WorkerContext context) throws Exception {
            cycles.incrementAndGet();
            if (trackEachCycle) {
                context.trackOperation("step", () -> {
                    Thread.sleep(1);
                });
            }
            afterCycle.run();
            if (failEveryCycle) {
                throw new IllegalStateException("cycle failed");
            }
        }

        @Override
        public void cleanup(WorkerContext context) {
            cleanups.incrementAndGet();
        }
    }
}
