package org.checkpulse.contract;

import org.checkpulse.state.CheckStatus;
import org.checkpulse.state.InfoPair;

import java.util.List;

/**
 * Interpreted outcome of one run: either a parsed contract (OK / FAILING) or an ERROR with a
 * diagnostic in {@code info}.
 */
public record CheckResult(CheckStatus status, boolean changing, String url, List<InfoPair> info) {

    public CheckResult {
        info = info == null ? List.of() : List.copyOf(info);
    }

    public static CheckResult error(String message, Integer exitCode) {
        if (exitCode != null && exitCode != 0) {
            return new CheckResult(CheckStatus.ERROR, false, null,
                    List.of(new InfoPair("Error", message), new InfoPair("Exit code", String.valueOf(exitCode))));
        }
        return new CheckResult(CheckStatus.ERROR, false, null, List.of(new InfoPair("Error", message)));
    }
}
