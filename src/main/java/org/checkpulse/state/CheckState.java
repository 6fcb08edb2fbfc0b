package org.checkpulse.state;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.contract.CheckResult;
import org.checkpulse.runner.RunResult;

import java.time.Instant;
import java.util.List;

/**
 * Current status of one registered check. Immutable; the store swaps whole records.
 */
public record CheckState(CheckDefinition definition,
                         CheckStatus status,
                         boolean changing,
                         String url,
                         List<InfoPair> info,
                         RunResult lastRun,
                         Instant updatedAt) {

    public CheckState {
        info = info == null ? List.of() : List.copyOf(info);
    }

    public static CheckState pending(CheckDefinition definition, Instant now) {
        return new CheckState(definition, CheckStatus.PENDING, false, null, List.of(), null, now);
    }

    public CheckState withResult(CheckResult result, RunResult run, Instant now) {
        return new CheckState(definition, result.status(), result.changing(), result.url(), result.info(), run, now);
    }

    public String name() {
        return definition.name();
    }
}
