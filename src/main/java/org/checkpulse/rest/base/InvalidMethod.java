package org.checkpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.checkpulse.utils.ResponseUtil;

/**
 * 405 for a known path hit with the wrong method; the status API only reads, apart from run.
 */
public class InvalidMethod implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED,
                exchange.getRequestMethod() + " is not supported on " + exchange.getRequestPath());
    }
}
