package org.miniworker.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;

public class RouteUtils {

    /**
     * Route that does not require authentication.
     * Runs on a worker thread with blocking IO, manager failures become error responses.
     */
    public static HttpHandler publicRoute(HttpHandler handler) {
        return new Dispatcher(
                new BlockingHandler(
                        new ManagerExceptionHandler(handler)
                )
        );
    }
}
