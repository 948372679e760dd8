package org.miniworker.tracking;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.miniworker.testing.MutableClock;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OperationTrackerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final AtomicInteger completions = new AtomicInteger();
    private final OperationTracker tracker = new OperationTracker(clock, completions::incrementAndGet);

    private Logger trackerLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        trackerLogger = (Logger) LoggerFactory.getLogger(OperationTracker.class);
        appender = new ListAppender<>();
        appender.start();
        trackerLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        trackerLogger.detachAppender(appender);
    }

    @Test
    void successfulOperationIsCountedWithItsDuration() throws Exception {
        tracker.track("fetch", () -> {
            clock.advanceMillis(250);
        });

        OperationStats stats = tracker.stats("fetch");
        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.totalDuration()).isCloseTo(0.25, within(1e-9));
        assertThat(stats.startTime()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z").getEpochSecond());
        assertThat(completions).hasValue(1);
    }

    @Test
    void failedAttemptIsExcludedAndRethrown() {
        IOException boom = new IOException("boom");

        assertThatThrownBy(() -> tracker.track("x", () -> {
            clock.advanceMillis(100);
            throw boom;
        })).isSameAs(boom);

        OperationStats stats = tracker.stats("x");
        assertThat(stats.count()).isZero();
        assertThat(stats.totalDuration()).isZero();
        assertThat(completions).hasValue(0);
        assertThat(appender.list)
                .anySatisfy(e -> {
                    assertThat(e.getFormattedMessage()).isEqualTo("Error in operation x: boom");
                    assertThat(e.getThrowableProxy()).isNotNull();
                });
    }

    @Test
    void onlyTheSucceedingOfTwoAttemptsCounts() throws Exception {
        assertThatThrownBy(() -> tracker.track("x", () -> {
            clock.advanceMillis(100);
            throw new IllegalStateException("first attempt fails");
        })).isInstanceOf(IllegalStateException.class);

        tracker.track("x", () -> {
            clock.advanceMillis(100);
        });

        OperationStats stats = tracker.stats("x");
        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.totalDuration()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void rateIsCumulativeAverageSinceFirstInvocation() throws Exception {
        tracker.track("job", () -> {
            clock.advance(Duration.ofMinutes(30));
        });
        assertThat(tracker.stats("job").ratePerHour()).isCloseTo(2.0, within(1e-9));

        clock.advance(Duration.ofMinutes(90));
        tracker.track("job", () -> {
        });
        // 2 completions over 2 hours
        assertThat(tracker.stats("job").ratePerHour()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void rateStaysZeroWhenNoTimeHasElapsed() throws Exception {
        tracker.track("instant", () -> {
        });

        OperationStats stats = tracker.stats("instant");
        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.ratePerHour()).isZero();
    }

    @Test
    void namesAreIndependent() throws Exception {
        tracker.track("a", () -> {
            clock.advanceMillis(10);
        });
        tracker.track("a", () -> {
            clock.advanceMillis(10);
        });
        tracker.track("b", () -> {
            clock.advanceMillis(10);
        });

        assertThat(tracker.snapshot()).containsOnlyKeys("a", "b");
        assertThat(tracker.stats("a").count()).isEqualTo(2);
        assertThat(tracker.stats("b").count()).isEqualTo(1);
        assertThat(tracker.stats("b").startTime()).isGreaterThan(tracker.stats("a").startTime());
    }

    @Test
    void trackReturnsTheResultOfTheOperation() throws Exception {
        String value = tracker.track("compute", () -> "result");

        assertThat(value).isEqualTo("result");
        assertThat(tracker.stats("compute").count()).isEqualTo(1);
    }

    @Test
    void failuresAreLoggedToTheWorkerLoggerOnceSet() {
        Logger workerLogger = (Logger) LoggerFactory.getLogger("mini_worker.tracker-test");
        ListAppender<ILoggingEvent> workerAppender = new ListAppender<>();
        workerAppender.start();
        workerLogger.addAppender(workerAppender);
        try {
            tracker.useLogger(workerLogger);
            assertThatThrownBy(() -> tracker.track("y", () -> {
                throw new IOException("down");
            })).isInstanceOf(IOException.class);

            assertThat(workerAppender.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Error in operation y: down");
        } finally {
            workerLogger.detachAppender(workerAppender);
        }
    }

    @Test
    void snapshotIsACopy() throws Exception {
        tracker.track("a", () -> {
        });
        var snapshot = tracker.snapshot();

        tracker.track("a", () -> {
        });

        assertThat(snapshot.get("a").count()).isEqualTo(1);
        assertThat(tracker.stats("a").count()).isEqualTo(2);
    }

    @Test
    void concurrentUseOfOneNameLosesNoCounts() throws Exception {
        OperationTracker shared = new OperationTracker(() -> { });
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    for (int j = 0; j < 250; j++) {
                        shared.track("shared", () -> {
                        });
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(shared.stats("shared").count()).isEqualTo(2000);
    }
}
