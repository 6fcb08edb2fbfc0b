package org.checkpulse.handlers.sse;

import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.state.CheckSnapshot;
import org.checkpulse.state.CheckStatus;
import org.checkpulse.state.StateListener;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams check snapshots: on connect, every push interval and whenever a run lands.
 */
public class SseCheckStatusHandler extends SseHandler {

    private final CheckOrchestrator orchestrator;
    private final long pushIntervalSeconds;
    private final StateListener onStateChange;

    public SseCheckStatusHandler(CheckOrchestrator orchestrator, long pushIntervalSeconds) {
        super(pushIntervalSeconds, pushIntervalSeconds);
        this.orchestrator = orchestrator;
        this.pushIntervalSeconds = pushIntervalSeconds;
        this.onStateChange = (previous, current) -> {
            if (!scheduler.isShutdown()) {
                scheduler.execute(this::pushToAll);
            }
        };
        orchestrator.getStateStore().addListener(onStateChange);
    }

    @Override
    public void shutdown() {
        orchestrator.getStateStore().removeListener(onStateChange);
        super.shutdown();
    }

    @Override
    protected Map<String, Object> generateData() {
        List<CheckSnapshot> checks = orchestrator.snapshot();
        int ok = 0, failing = 0, errors = 0, pending = 0, changing = 0;
        for (CheckSnapshot check : checks) {
            if (check.status() == CheckStatus.OK) ok++;
            if (check.status() == CheckStatus.FAILING) failing++;
            if (check.status() == CheckStatus.ERROR) errors++;
            if (check.status() == CheckStatus.PENDING) pending++;
            if (check.changing()) changing++;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("total_checks", checks.size());
        response.put("ok_count", ok);
        response.put("failing_count", failing);
        response.put("error_count", errors);
        response.put("pending_count", pending);
        response.put("changing_count", changing);
        response.put("checks", checks);
        response.put("sse_push_interval_seconds", pushIntervalSeconds);
        return response;
    }
}
