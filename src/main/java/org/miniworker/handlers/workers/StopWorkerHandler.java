package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.HttpRequestUtil;
import org.miniworker.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /workers/{name}/stop - blocks until the worker exited or was killed
 */
public class StopWorkerHandler implements HttpHandler {

    private final WorkerManager manager;

    public StopWorkerHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = HttpRequestUtil.pathParam(exchange, "name");
        boolean graceful = manager.stop(name);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("graceful", graceful);
        ResponseUtil.sendSuccess(exchange, graceful ? "Worker " + name + " stopped" : "Worker " + name + " killed", data);
    }
}
