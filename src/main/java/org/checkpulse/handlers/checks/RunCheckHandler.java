package org.checkpulse.handlers.checks;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.utils.ResponseUtil;

import static org.checkpulse.rest.base.RouteUtils.pathParam;

/**
 * POST to run a check now. Refused with 409 while the check is already running.
 */
public class RunCheckHandler implements HttpHandler {

    private final CheckOrchestrator orchestrator;

    public RunCheckHandler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = pathParam(exchange, "name");
        if (!orchestrator.isKnown(name)) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Unknown check: " + name);
            return;
        }
        if (orchestrator.runNow(name)) {
            ResponseUtil.sendAccepted(exchange, "Check " + name + " started", null);
        } else {
            ResponseUtil.sendError(exchange, StatusCodes.CONFLICT, "Check " + name + " is already running");
        }
    }
}
