package org.checkpulse.handlers.checks;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.utils.ResponseUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.checkpulse.rest.base.RouteUtils.pathParam;

/**
 * GET the debug view of a check: its definition, current snapshot and recent runs
 * with command, stdout and stderr.
 */
public class CheckDebugHandler implements HttpHandler {

    private final CheckOrchestrator orchestrator;

    public CheckDebugHandler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String name = pathParam(exchange, "name");
        Optional<CheckOrchestrator.DebugView> view = orchestrator.debugView(name);
        if (view.isEmpty()) {
            ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "Unknown check: " + name);
            return;
        }

        CheckDefinition def = view.get().definition();
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("name", def.name());
        definition.put("command", def.command());
        definition.put("source_file", def.sourceFile().toString());
        definition.put("working_directory", def.workingDirectory().toString());
        definition.put("section", def.section());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("definition", definition);
        data.put("running", view.get().running());
        data.put("state", view.get().snapshot());
        data.put("history", view.get().history());

        ResponseUtil.sendSuccess(exchange, "Debug view for " + name, data);
    }
}
