package org.checkpulse.state;

import org.checkpulse.runner.RunResult;

import java.time.Instant;
import java.util.List;

/**
 * What the UI collaborator reads for one check.
 */
public record CheckSnapshot(String name,
                            String section,
                            CheckStatus status,
                            boolean changing,
                            String url,
                            List<InfoPair> info,
                            RunResult lastRun,
                            Instant updatedAt) {

    static CheckSnapshot of(CheckState state) {
        return new CheckSnapshot(state.name(), state.definition().section(), state.status(), state.changing(),
                state.url(), state.info(), state.lastRun(), state.updatedAt());
    }
}
