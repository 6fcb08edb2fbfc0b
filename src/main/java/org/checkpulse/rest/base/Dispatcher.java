package org.checkpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.checkpulse.config.utils.LogContext;

/**
 * Moves request handling off the IO thread onto a worker thread, with the status API log context.
 */
public class Dispatcher implements HttpHandler {
    private final HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        LogContext.start("StatusApi");
        try {
            handler.handleRequest(exchange);
        } finally {
            LogContext.clear();
        }
    }
}
