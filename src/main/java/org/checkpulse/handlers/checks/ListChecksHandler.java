package org.checkpulse.handlers.checks;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.state.CheckSnapshot;
import org.checkpulse.utils.ResponseUtil;

import java.util.List;

/**
 * GET all check snapshots, ordered by name.
 */
public class ListChecksHandler implements HttpHandler {

    private final CheckOrchestrator orchestrator;

    public ListChecksHandler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        List<CheckSnapshot> checks = orchestrator.snapshot();
        ResponseUtil.sendSuccess(exchange, checks.size() + " checks", checks);
    }
}
