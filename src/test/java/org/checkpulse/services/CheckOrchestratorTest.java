package org.checkpulse.services;

import org.checkpulse.runner.CommandRunner;
import org.checkpulse.state.CheckStatus;
import org.checkpulse.state.StateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real commands through the whole pipeline.
 */
class CheckOrchestratorTest {

    @TempDir
    Path root;

    private CheckOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new CheckOrchestrator(root, 60, 50,
                new CommandRunner(null, 10), new StateStore(20), new CheckScheduler(0));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void reloadReconcilesAgainstTheDirectory() throws Exception {
        Path checkfile = root.resolve("checks");
        Files.writeString(checkfile, "a: echo '{\"result\": true}'\nb: echo '{\"result\": false}'\n");

        var first = orchestrator.reload();
        assertEquals(List.of("a", "b"), first.added());
        awaitStatus("a", CheckStatus.OK);
        awaitStatus("b", CheckStatus.FAILING);

        Files.writeString(checkfile, "a: echo '{\"result\": true}'\nc: echo not json\n");
        var second = orchestrator.reload();

        assertEquals(List.of("c"), second.added());
        assertEquals(List.of("b"), second.removed());
        assertEquals(List.of("a"), second.unchanged());
        assertFalse(orchestrator.isKnown("b"));
        assertEquals(CheckStatus.OK, orchestrator.snapshot("a").orElseThrow().status());
        awaitStatus("c", CheckStatus.ERROR);
    }

    @Test
    void startWatchesForNewCheckfiles() throws Exception {
        orchestrator.start();
        assertTrue(orchestrator.isWatching());

        Files.writeString(root.resolve("late"), "late: echo '{\"result\": true}'\n");

        awaitStatus("late", CheckStatus.OK);
    }

    @Test
    void debugViewCarriesDefinitionAndHistory() throws Exception {
        Files.writeString(root.resolve("checks"), "#- Infra\nup: echo '{\"result\": true}'\n");
        orchestrator.reload();
        awaitStatus("up", CheckStatus.OK);

        var view = orchestrator.debugView("up").orElseThrow();

        assertEquals("echo '{\"result\": true}'", view.definition().command());
        assertEquals("Infra", view.snapshot().section());
        assertEquals(1, view.history().size());
        assertTrue(orchestrator.debugView("nope").isEmpty());
    }

    @Test
    void intervalMustBePositive() {
        orchestrator.setCheckRunInterval(5);

        assertEquals(5, orchestrator.getCheckRunInterval());
        assertThrows(IllegalArgumentException.class, () -> orchestrator.setCheckRunInterval(0));
    }

    private void awaitStatus(String name, CheckStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 15000;
        while (true) {
            var status = orchestrator.snapshot(name).map(s -> s.status()).orElse(null);
            if (status == expected) return;
            assertTrue(System.currentTimeMillis() < deadline, name + " is " + status + ", expected " + expected);
            Thread.sleep(20);
        }
    }
}
