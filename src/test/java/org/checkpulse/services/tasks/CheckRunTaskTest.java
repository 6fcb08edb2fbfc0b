package org.checkpulse.services.tasks;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.contract.ContractParser;
import org.checkpulse.runner.CommandRunner;
import org.checkpulse.runner.RunResult;
import org.checkpulse.state.CheckStatus;
import org.checkpulse.state.InfoPair;
import org.checkpulse.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CheckRunTaskTest {

    @TempDir
    Path dir;

    private StateStore stateStore;
    private final ContractParser parser = new ContractParser();
    private final CommandRunner runner = new CommandRunner(null, 10);

    @BeforeEach
    void setUp() {
        stateStore = new StateStore(20);
    }

    @Test
    void passingCheckBecomesOk() {
        var definition = register("ok", "echo '{\"result\": true, \"info\": [[\"Load\", \"0.1\"]]}'");

        new CheckRunTask(definition, 10, runner, parser, stateStore).execute();

        var state = stateStore.get("ok").orElseThrow();
        assertEquals(CheckStatus.OK, state.status());
        assertEquals(List.of(new InfoPair("Load", "0.1")), state.info());
        assertEquals(0, state.lastRun().exitCode());
    }

    @Test
    void failingResultBecomesFailing() {
        var definition = register("red", "echo '{\"result\": false, \"changing\": true}'; exit 1");

        new CheckRunTask(definition, 10, runner, parser, stateStore).execute();

        var state = stateStore.get("red").orElseThrow();
        assertEquals(CheckStatus.FAILING, state.status());
        assertTrue(state.changing());
    }

    @Test
    void malformedStdoutBecomesErrorWithDiagnostic() {
        var definition = register("bad", "echo not json");

        new CheckRunTask(definition, 10, runner, parser, stateStore).execute();

        var state = stateStore.get("bad").orElseThrow();
        assertEquals(CheckStatus.ERROR, state.status());
        assertEquals("Error", state.info().get(0).label());
        assertTrue(state.info().get(0).value().contains("not valid JSON"));
        assertEquals("not json\n", state.lastRun().stdout());
        assertEquals(1, stateStore.history("bad").size());
    }

    @Test
    void unexpectedRunnerFailureIsRecordedAsError() {
        var definition = register("boom", "true");
        CommandRunner broken = mock(CommandRunner.class);
        when(broken.run(any())).thenThrow(new IllegalStateException("runner exploded"));

        new CheckRunTask(definition, 10, broken, parser, stateStore).execute();

        var state = stateStore.get("boom").orElseThrow();
        assertEquals(CheckStatus.ERROR, state.status());
        assertEquals("Internal error: runner exploded", state.info().get(0).value());
        assertEquals(RunResult.Termination.SPAWN_FAILED, state.lastRun().termination());
    }

    @Test
    void resultIsDiscardedWhenCheckIsReAddedDuringTheRun() {
        var definition = register("flaky", "true");
        CommandRunner reAdding = mock(CommandRunner.class);
        when(reAdding.run(any())).thenAnswer(invocation -> {
            stateStore.remove("flaky");
            stateStore.register(definition);
            return runner.run(definition);
        });

        new CheckRunTask(definition, 10, reAdding, parser, stateStore).execute();

        assertEquals(CheckStatus.PENDING, stateStore.get("flaky").orElseThrow().status());
        assertTrue(stateStore.history("flaky").isEmpty());
    }

    @Test
    void exposesNameAndInterval() {
        var definition = register("named", "true");
        var task = new CheckRunTask(definition, 42, runner, parser, stateStore);

        assertEquals("named", task.name());
        assertEquals(42, task.intervalSeconds());
        assertSame(definition, task.definition());
    }

    private CheckDefinition register(String name, String command) {
        var definition = new CheckDefinition(name, command, dir.resolve("checks"), dir, null);
        stateStore.register(definition);
        return definition;
    }
}
