package org.checkpulse.rest.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;

import java.util.Deque;

public class RouteUtils {

    private RouteUtils() {}

    /**
     * Route dispatched to a worker thread in blocking mode.
     */
    public static HttpHandler route(HttpHandler handler) {
        return new Dispatcher(new BlockingHandler(handler));
    }

    /**
     * Path template parameter, e.g. {@code {name}} in {@code /checks/{name}}.
     */
    public static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }
}
