package org.checkpulse.runner;

import java.time.Duration;
import java.time.Instant;

/**
 * Raw outcome of one command execution, kept for the debug view.
 */
public record RunResult(String command,
                        int exitCode,
                        String stdout,
                        String stderr,
                        Instant startedAt,
                        Duration duration,
                        Termination termination) {

    public enum Termination {
        EXITED,
        TIMED_OUT,
        /** The waiting thread was interrupted, usually by shutdown; the process was killed. */
        INTERRUPTED,
        SPAWN_FAILED
    }

    public static RunResult spawnFailed(String command, Instant startedAt, Duration duration, String reason) {
        return new RunResult(command, -1, "", "failed to start: " + reason, startedAt, duration, Termination.SPAWN_FAILED);
    }

    public boolean exited() {
        return termination == Termination.EXITED;
    }
}
