package org.checkpulse.services;

import org.checkpulse.checkfile.CheckDefinition;
import org.checkpulse.checkfile.CheckFile;
import org.checkpulse.checkfile.CheckfileParser;
import org.checkpulse.checkfile.CheckfileScanner;
import org.checkpulse.config.ConfigLoader;
import org.checkpulse.config.XmlConfiguration;
import org.checkpulse.config.utils.LogContext;
import org.checkpulse.contract.ContractParser;
import org.checkpulse.registry.CheckRegistry;
import org.checkpulse.registry.RegistryDiff;
import org.checkpulse.runner.CommandRunner;
import org.checkpulse.runner.RunResult;
import org.checkpulse.services.tasks.CheckRunTask;
import org.checkpulse.state.CheckSnapshot;
import org.checkpulse.state.CheckState;
import org.checkpulse.state.StateStore;
import org.checkpulse.watch.CheckfileWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Root object wiring discovery, registry, scheduler, runner and state.
 * One instance per process, constructed explicitly by {@code Main}.
 */
public class CheckOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CheckOrchestrator.class);

    /**
     * What the debug view renders for one check.
     */
    public record DebugView(CheckDefinition definition, CheckSnapshot snapshot, List<RunResult> history,
                            boolean running) {}

    private final Path checkfilesDir;
    private final long reloadDebounceMillis;
    private final CheckfileScanner scanner;
    private final StateStore stateStore;
    private final CheckScheduler scheduler;
    private final CheckRegistry registry;
    private final CommandRunner runner;
    private final ContractParser parser = new ContractParser();

    private volatile int checkRunInterval;
    private CheckfileWatcher watcher;

    public CheckOrchestrator(XmlConfiguration.Checks cfg) {
        this(ConfigLoader.resolvePath(cfg.checkfilesDir),
                cfg.checkRunInterval,
                cfg.reloadDebounceMillis,
                new CommandRunner(cfg.scriptsDir == null || cfg.scriptsDir.isBlank() ? null : ConfigLoader.resolvePath(cfg.scriptsDir),
                        cfg.commandTimeoutSeconds),
                new StateStore(cfg.historySize),
                new CheckScheduler(cfg.workerThreads));
    }

    public CheckOrchestrator(Path checkfilesDir, int checkRunInterval, long reloadDebounceMillis,
                             CommandRunner runner, StateStore stateStore, CheckScheduler scheduler) {
        this.checkfilesDir = checkfilesDir;
        this.checkRunInterval = checkRunInterval;
        this.reloadDebounceMillis = reloadDebounceMillis;
        this.runner = runner;
        this.stateStore = stateStore;
        this.scheduler = scheduler;
        this.scanner = new CheckfileScanner(new CheckfileParser());
        this.registry = new CheckRegistry(stateStore, scheduler, this::newTask);
        this.stateStore.addListener(CheckOrchestrator::logTransition);
    }

    /**
     * Loads every checkfile, schedules the checks and starts watching for changes.
     */
    public synchronized void start() {
        logger.info("[------------ Loading checks from {} ------------]", checkfilesDir);
        reload();
        watcher = new CheckfileWatcher(checkfilesDir, reloadDebounceMillis, this::reload);
        watcher.start();
    }

    /**
     * Re-scans the checkfiles directory and reconciles the registry.
     */
    public RegistryDiff reload() {
        LogContext.start("CheckOrchestrator");
        try {
            List<CheckFile> files = scanner.scan(checkfilesDir);
            return registry.reconcile(files);
        } finally {
            LogContext.clear();
        }
    }

    public List<CheckSnapshot> snapshot() {
        return stateStore.snapshot();
    }

    public Optional<CheckSnapshot> snapshot(String name) {
        return stateStore.snapshot(name);
    }

    /**
     * Runs a check now, unless it is already running.
     */
    public boolean runNow(String name) {
        return scheduler.runNow(name);
    }

    public boolean isKnown(String name) {
        return stateStore.contains(name);
    }

    public Optional<DebugView> debugView(String name) {
        Optional<CheckState> state = stateStore.get(name);
        return state.map(s -> new DebugView(s.definition(), stateStore.snapshot(name).orElse(null),
                stateStore.history(name), scheduler.isRunning(name)));
    }

    /**
     * Applies to timers created from now on; running timers keep their period until rescheduled.
     */
    public void setCheckRunInterval(int seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("checkRunInterval must be positive");
        }
        logger.info("Check run interval set to {}s for newly scheduled checks", seconds);
        this.checkRunInterval = seconds;
    }

    public int getCheckRunInterval() {
        return checkRunInterval;
    }

    public boolean isWatching() {
        return watcher != null && watcher.isActive();
    }

    public Path getCheckfilesDir() {
        return checkfilesDir;
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    public CheckRegistry getRegistry() {
        return registry;
    }

    public synchronized void shutdown() {
        if (watcher != null) {
            watcher.close();
        }
        scheduler.shutdown();
    }

    private ScheduledTask newTask(CheckDefinition definition) {
        return new CheckRunTask(definition, checkRunInterval, runner, parser, stateStore);
    }

    private static void logTransition(CheckState previous, CheckState current) {
        if (previous == null || current == null) return;
        if (previous.status() != current.status()) {
            logger.info("Check '{}' changed status: {} -> {}", current.name(), previous.status(), current.status());
        }
    }
}
