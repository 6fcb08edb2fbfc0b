package org.checkpulse.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.checkpulse.config.utils.EnvironmentProvider;
import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.state.CheckSnapshot;
import org.checkpulse.state.CheckStatus;
import org.checkpulse.utils.ResponseUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for the health endpoint.
 * Returns  -  basic app info,
 *          -  watcher status,
 *          -  check counts per status.
 */
public class HealthCheckHandler implements HttpHandler {

    private static final Instant START_TIME = Instant.now();

    private final CheckOrchestrator orchestrator;

    public HealthCheckHandler(CheckOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "CheckPulse");
        response.put("version", "1.0.0");
        response.put("environment", EnvironmentProvider.getEnvironment());
        response.put("uptime_seconds", Duration.between(START_TIME, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now().toString());
        response.put("checkfiles_dir", orchestrator.getCheckfilesDir().toString());
        response.put("watching", orchestrator.isWatching());
        response.put("check_run_interval", orchestrator.getCheckRunInterval());

        Map<CheckStatus, Integer> counts = new EnumMap<>(CheckStatus.class);
        for (CheckStatus status : CheckStatus.values()) counts.put(status, 0);
        for (CheckSnapshot snapshot : orchestrator.snapshot()) {
            counts.merge(snapshot.status(), 1, Integer::sum);
        }
        response.put("checks", counts);

        ResponseUtil.sendSuccess(exchange, "Health check completed", response);
    }
}
