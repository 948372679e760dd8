package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.ResponseUtil;

/**
 * GET /workers - status of every registered worker
 */
public class ListWorkersHandler implements HttpHandler {

    private final WorkerManager manager;

    public ListWorkersHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendSuccess(exchange, "Worker statuses", manager.statusAll());
    }
}
