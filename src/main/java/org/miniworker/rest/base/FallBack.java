package org.miniworker.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.miniworker.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/***
 * Handles routes the management API does not know
 * */
public class FallBack implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(FallBack.class);

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String uri = exchange.getRequestURI();
        logger.debug("No route for {} {}", exchange.getRequestMethod(), uri);
        ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND,
                "No route for " + exchange.getRequestMethod() + " " + uri);
    }
}
