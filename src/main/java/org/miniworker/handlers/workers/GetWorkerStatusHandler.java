package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.miniworker.manager.WorkerManager;
import org.miniworker.manager.exceptions.UnknownWorkerException;
import org.miniworker.utils.HttpRequestUtil;
import org.miniworker.utils.ResponseUtil;

/**
 * GET /workers/{name} - liveness, process info and last snapshot of one worker
 */
public class GetWorkerStatusHandler implements HttpHandler {

    private final WorkerManager manager;

    public GetWorkerStatusHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = HttpRequestUtil.pathParam(exchange, "name");
        if (!manager.isRegistered(name)) {
            throw new UnknownWorkerException(name, manager.availableWorkers());
        }
        ResponseUtil.sendSuccess(exchange, "Worker status", manager.status(name));
    }
}
