package org.miniworker.workers;

import org.miniworker.utils.SystemInfo;
import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerContext;

import java.nio.file.NoSuchFileException;
import java.util.Locale;

/**
 * Checks free disk space of {@code path} (default {@code .}) every cycle and warns
 * below {@code min_free_percent} (default 10).
 */
public class DiskUsageWorker implements Worker {

    private volatile double lastFreePercent = -1;

    @Override
    public String workerId() {
        return "disk_usage_worker";
    }

    @Override
    public void doWork(WorkerContext context) throws Exception {
        String path = context.stringParam("path", ".");
        double minFreePercent = context.doubleParam("min_free_percent", 10);

        double freePercent = context.trackResult("check_disk", () -> {
            double measured = SystemInfo.freeDiskPercent(path);
            if (measured < 0) {
                throw new NoSuchFileException(path);
            }
            return measured;
        });
        lastFreePercent = freePercent;

        long freeBytes = SystemInfo.freeDiskBytes(path);
        long totalBytes = SystemInfo.totalDiskBytes(path);
        String percent = String.format(Locale.ROOT, "%.2f", freePercent);
        if (freePercent < minFreePercent) {
            context.logger().warn("[DiskCheck] {} low on space: {}% free ({} of {} bytes)",
                    path, percent, freeBytes, totalBytes);
        } else {
            context.logger().info("[DiskCheck] {}: {}% free ({} of {} bytes)",
                    path, percent, freeBytes, totalBytes);
        }
    }

    double lastFreePercent() {
        return lastFreePercent;
    }
}
