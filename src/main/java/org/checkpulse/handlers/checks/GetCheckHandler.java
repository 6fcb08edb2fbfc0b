package org.checkpulse.handlers.checks;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.utils.ResponseUtil;

import static org.checkpulse.rest.base.RouteUtils.pathParam;

public class GetCheckHandler implements HttpHandler {

    private final CheckOrchestrator orchestrator;

    public GetCheckHandler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = pathParam(exchange, "name");
        orchestrator.snapshot(name).ifPresentOrElse(
                snapshot -> ResponseUtil.sendSuccess(exchange, "Check " + name, snapshot),
                () -> ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Unknown check: " + name));
    }
}
