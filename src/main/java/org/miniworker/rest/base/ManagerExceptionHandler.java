package org.miniworker.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.miniworker.manager.exceptions.AlreadyRunningException;
import org.miniworker.manager.exceptions.NotRunningException;
import org.miniworker.manager.exceptions.ProcessNotFoundException;
import org.miniworker.manager.exceptions.RegistrationException;
import org.miniworker.manager.exceptions.UnknownWorkerException;
import org.miniworker.manager.exceptions.WorkerManagerException;
import org.miniworker.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns manager failures thrown by the wrapped handler into error responses.
 */
public class ManagerExceptionHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(ManagerExceptionHandler.class);

    private final HttpHandler next;

    public ManagerExceptionHandler(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            next.handleRequest(exchange);
        } catch (WorkerManagerException e) {
            int status = statusFor(e);
            if (status >= 500) {
                logger.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            } else {
                logger.info("{} {} rejected: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            }
            ResponseUtil.sendError(exchange, status, e.getMessage());
        }
    }

    public static int statusFor(WorkerManagerException e) {
        if (e instanceof UnknownWorkerException) return StatusCodes.NOT_FOUND;
        if (e instanceof AlreadyRunningException || e instanceof NotRunningException) return StatusCodes.CONFLICT;
        if (e instanceof RegistrationException) return StatusCodes.BAD_REQUEST;
        if (e instanceof ProcessNotFoundException) return StatusCodes.GONE;
        return StatusCodes.INTERNAL_SERVER_ERROR;
    }
}
