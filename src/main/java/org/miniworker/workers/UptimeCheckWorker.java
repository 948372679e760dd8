package org.miniworker.workers;

import org.miniworker.worker.Worker;
import org.miniworker.worker.WorkerContext;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * UptimeCheckWorker: monitors a single HTTP service.
 * <p>
 * Params: {@code url} (required), {@code name} (defaults to the url host),
 * {@code retry_count} (0), {@code retry_delay_seconds} (1), {@code expected_status}
 * (200), {@code timeout_seconds} (8).
 * <p>
 * Each check is tracked as {@code check_<name>}. A DOWN result fails the tracked
 * block, so a service that keeps failing shows up as a stalled operation count.
 */
public class UptimeCheckWorker implements Worker {

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    private volatile String lastStatus = "UNKNOWN";

    @Override
    public String workerId() {
        return "uptime_check_worker";
    }

    @Override
    public void setup(WorkerContext context) {
        String url = context.stringParam("url", null);
        if (url == null || url.isBlank()) {
            context.logger().warn("No 'url' parameter given, every check will fail");
        } else {
            context.logger().info("Monitoring {} as '{}'", url, serviceName(context, url));
        }
    }

    @Override
    public void doWork(WorkerContext context) throws Exception {
        String url = context.stringParam("url", null);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Missing required parameter: url");
        }
        String name = serviceName(context, url);
        context.trackOperation("check_" + name, () -> check(context, name, url));
    }

    private void check(WorkerContext context, String name, String url) throws Exception {
        Logger log = context.logger();
        int retryCount = Math.max(0, context.intParam("retry_count", 0));
        long retryDelayMillis = (long) (context.doubleParam("retry_delay_seconds", 1) * 1000);
        int expectedStatus = context.intParam("expected_status", 200);
        Duration timeout = Duration.ofSeconds(context.longParam("timeout_seconds", 8));

        String status = "DOWN";
        String errorMessage = null;
        int httpCode = -1;
        long responseTime = -1;

        // retry loop
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            long start = System.currentTimeMillis();
            try {
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .timeout(timeout)
                        .GET()
                        .build();
                HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
                responseTime = System.currentTimeMillis() - start;
                httpCode = response.statusCode();

                if (httpCode == expectedStatus) {
                    status = "UP";
                    errorMessage = null;
                    break;
                }
                errorMessage = "Unexpected HTTP code: " + httpCode;
            } catch (IOException e) {
                responseTime = System.currentTimeMillis() - start;
                errorMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
            }

            if (attempt < retryCount && !context.isShutdownRequested()) {
                Thread.sleep(retryDelayMillis);
            }
        }

        if (!status.equals(lastStatus)) {
            log.info("Service '{}' changed {} -> {}", name, lastStatus, status);
        }
        lastStatus = status;

        log.info("Service '{}' checked: status={}, responseTime={}ms, httpCode={}, error={}",
                name, status, responseTime, httpCode, errorMessage);

        if ("DOWN".equals(status)) {
            throw new ServiceDownException("Service '" + name + "' is DOWN: " + errorMessage, httpCode);
        }
    }

    private static String serviceName(WorkerContext context, String url) {
        String name = context.stringParam("name", null);
        if (name != null && !name.isBlank()) {
            return name;
        }
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    String lastStatus() {
        return lastStatus;
    }
}
