package org.checkpulse.services.tasks;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.contract.CheckResult;
import org.checkpulse.contract.ContractParser;
import org.checkpulse.runner.CommandRunner;
import org.checkpulse.runner.RunResult;
import org.checkpulse.services.ScheduledTask;
import org.checkpulse.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * CheckRunTask: runs a single check and records its result.
 */
public class CheckRunTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(CheckRunTask.class);

    private final CheckDefinition definition;
    private final long intervalSeconds;
    private final CommandRunner runner;
    private final ContractParser parser;
    private final StateStore stateStore;

    public CheckRunTask(CheckDefinition definition, long intervalSeconds,
                        CommandRunner runner, ContractParser parser, StateStore stateStore) {
        this.definition = definition;
        this.intervalSeconds = intervalSeconds;
        this.runner = runner;
        this.parser = parser;
        this.stateStore = stateStore;
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public long intervalSeconds() {
        return intervalSeconds;
    }

    public CheckDefinition definition() {
        return definition;
    }

    @Override
    public void execute() {
        long generation = stateStore.generation(definition.name());
        RunResult run;
        CheckResult result;
        try {
            run = runner.run(definition);
            result = parser.interpret(run);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure running check '{}'", definition.name(), e);
            run = new RunResult(definition.command(), -1, "", String.valueOf(e), Instant.now(), Duration.ZERO,
                    RunResult.Termination.SPAWN_FAILED);
            result = CheckResult.error("Internal error: " + e.getMessage(), null);
        }

        boolean applied = stateStore.apply(definition, generation, run, result);

        logger.debug("Check '{}' ran: status={}, exit={}, duration={}ms, applied={}",
                definition.name(), result.status(), run.exitCode(), run.duration().toMillis(), applied);
    }
}
