package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.ResponseUtil;

/**
 * GET /workers/available - registered worker names
 */
public class AvailableWorkersHandler implements HttpHandler {

    private final WorkerManager manager;

    public AvailableWorkersHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendSuccess(exchange, "Available workers", manager.availableWorkers());
    }
}
