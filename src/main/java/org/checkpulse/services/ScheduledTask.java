package org.checkpulse.services;

public interface ScheduledTask {
    /**
     * A short name used for logging and as the scheduler key.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Implementations should catch exceptions and record them.
     */
    void execute();
}
