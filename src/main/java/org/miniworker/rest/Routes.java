package org.miniworker.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.miniworker.handlers.HealthCheckHandler;
import org.miniworker.handlers.workers.AvailableWorkersHandler;
import org.miniworker.handlers.workers.GetWorkerStatusHandler;
import org.miniworker.handlers.workers.ListWorkersHandler;
import org.miniworker.handlers.workers.ReloadWorkersHandler;
import org.miniworker.handlers.workers.StartWorkerHandler;
import org.miniworker.handlers.workers.StopWorkerHandler;
import org.miniworker.manager.WorkerManager;
import org.miniworker.rest.base.Dispatcher;
import org.miniworker.rest.base.FallBack;
import org.miniworker.rest.base.InvalidMethod;

import java.nio.file.Path;

import static org.miniworker.rest.base.RouteUtils.publicRoute;

/**
 * Paths are relative to the configured base path.
 */
public class Routes {

    public static RoutingHandler api(WorkerManager manager, Path configPath) {
        return Handlers.routing()
                .get("/system/health", publicRoute(new HealthCheckHandler(manager)))

                .get("/workers", publicRoute(new ListWorkersHandler(manager)))
                .get("/workers/available", publicRoute(new AvailableWorkersHandler(manager)))
                .post("/workers/reload", publicRoute(new ReloadWorkersHandler(manager, configPath)))
                .get("/workers/{name}", publicRoute(new GetWorkerStatusHandler(manager)))
                .post("/workers/{name}/start", publicRoute(new StartWorkerHandler(manager)))
                .post("/workers/{name}/stop", publicRoute(new StopWorkerHandler(manager)))

                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
