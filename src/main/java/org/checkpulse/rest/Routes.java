package org.checkpulse.rest;

import io.undertow.Handlers;
import io.undertow.server.RoutingHandler;
import org.checkpulse.handlers.HealthCheckHandler;
import org.checkpulse.handlers.checks.CheckDebugHandler;
import org.checkpulse.handlers.checks.GetCheckHandler;
import org.checkpulse.handlers.checks.ListChecksHandler;
import org.checkpulse.handlers.checks.RunCheckHandler;
import org.checkpulse.rest.base.Dispatcher;
import org.checkpulse.rest.base.FallBack;
import org.checkpulse.rest.base.InvalidMethod;
import org.checkpulse.services.CheckOrchestrator;

import static org.checkpulse.rest.base.RouteUtils.route;

public class Routes {

    private Routes() {}

    public static RoutingHandler checks(CheckOrchestrator orchestrator) {
        return Handlers.routing()
                .get("", route(new ListChecksHandler(orchestrator)))
                .get("/", route(new ListChecksHandler(orchestrator)))
                .get("/{name}", route(new GetCheckHandler(orchestrator)))
                .get("/{name}/debug", route(new CheckDebugHandler(orchestrator)))
                .post("/{name}/run", route(new RunCheckHandler(orchestrator)))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    public static RoutingHandler system(CheckOrchestrator orchestrator) {
        return Handlers.routing()
                .get("/health", route(new HealthCheckHandler(orchestrator)))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }
}
