package org.miniworker.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.miniworker.utils.ResponseUtil;

/**
 * Known path, wrong verb. The management API only reads with GET and acts with POST.
 * */
public class InvalidMethod implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String method = exchange.getRequestMethod().toString();
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                "Method " + method + " not allowed on " + exchange.getRequestPath());
    }
}
