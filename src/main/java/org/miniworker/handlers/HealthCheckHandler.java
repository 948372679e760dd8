package org.miniworker.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.miniworker.config.utils.EnvironmentProvider;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for health check endpoint.
 * Returns  -  basic app info,
 *          -  how many registered workers are running.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final WorkerManager manager;

    public HealthCheckHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "Mini-Worker Manager");
        response.put("version", "0.1.0");
        response.put("environment", EnvironmentProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());

        List<String> workers = manager.availableWorkers();
        long running = workers.stream().filter(manager::isRunning).count();
        response.put("registered_workers", workers.size());
        response.put("running_workers", running);
        response.put("stats_dir", manager.settings().statsDir().toString());

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
