package org.miniworker.testing;

import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerContext;

/**
 * Worker classes loaded by name in tests.
 */
public final class TestWorkers {

    private TestWorkers() {}

    public static String nameOf(Class<?> type) {
        return type.getName();
    }

    public static class NoopWorker implements Worker {
        @Override
        public String workerId() {
            return "noop_worker";
        }

        @Override
        public void doWork(WorkerContext context) {
            context.logger().info("noop cycle");
        }
    }

    public abstract static class AbstractWorker implements Worker {
    }

    static class HiddenWorker implements Worker {
        @Override
        public String workerId() {
            return "hidden";
        }

        @Override
        public void doWork(WorkerContext context) {
        }
    }

    public static class NeedsArgumentWorker implements Worker {
        private final String id;

        public NeedsArgumentWorker(String id) {
            this.id = id;
        }

        @Override
        public String workerId() {
            return id;
        }

        @Override
        public void doWork(WorkerContext context) {
        }
    }

    public static class ExplodingWorker implements Worker {
        public ExplodingWorker() {
            throw new IllegalStateException("no resources");
        }

        @Override
        public String workerId() {
            return "exploding";
        }

        @Override
        public void doWork(WorkerContext context) {
        }
    }

    public static class NotAWorker {
    }
}
