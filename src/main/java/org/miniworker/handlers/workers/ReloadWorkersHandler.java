package org.miniworker.handlers.workers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.miniworker.config.ConfigLoader;
import org.miniworker.config.XmlConfiguration;
import org.miniworker.manager.WorkerManager;
import org.miniworker.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * POST /workers/reload - re-reads the worker registry from the XML configuration.
 * Running workers are not touched.
 */
public class ReloadWorkersHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(ReloadWorkersHandler.class);

    private final WorkerManager manager;
    private final Path configPath;

    public ReloadWorkersHandler(WorkerManager manager, Path configPath) {
        this.manager = manager;
        this.configPath = configPath;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        XmlConfiguration cfg;
        try {
            cfg = ConfigLoader.loadConfig(configPath);
            manager.reload(ConfigLoader.registrations(cfg));
        } catch (IllegalStateException e) {
            logger.error("Worker reload failed: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Workers reload failed: " + e.getMessage());
            return;
        }
        ResponseUtil.sendSuccess(exchange, "Workers reloaded successfully", manager.availableWorkers());
    }
}
