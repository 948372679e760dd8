package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.HttpRequestUtil;
import org.miniworker.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /workers/{name}/start
 * Optional body: {"parameters": {...}} handed to the worker as --worker-params.
 */
public class StartWorkerHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(StartWorkerHandler.class);

    private final WorkerManager manager;

    public StartWorkerHandler(WorkerManager manager) {
        this.manager = manager;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = HttpRequestUtil.pathParam(exchange, "name");

        Map<String, Object> body = HttpRequestUtil.parseJson(exchange);
        if (body == null) {
            return;
        }
        Map<String, Object> parameters = Map.of();
        if (body.containsKey("parameters")) {
            parameters = HttpRequestUtil.getMap(body, "parameters");
            if (parameters == null) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Field 'parameters' must be a JSON object");
                return;
            }
        }

        long pid = manager.start(name, parameters);
        logger.info("Worker {} started via API (pid {})", name, pid);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("worker_id", manager.uniqueId(name));
        data.put("pid", pid);
        ResponseUtil.sendAccepted(exchange, "Worker " + name + " started", data);
    }
}
